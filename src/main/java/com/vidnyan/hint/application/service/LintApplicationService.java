package com.vidnyan.hint.application.service;

import com.vidnyan.hint.application.port.in.LintSourceUseCase;
import com.vidnyan.hint.application.port.out.SourceCodeParser;
import com.vidnyan.hint.application.port.out.SourceParseException;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import com.vidnyan.hint.domain.rule.RuleRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Main application service that orchestrates linting of one file.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LintApplicationService implements LintSourceUseCase {

    private final SourceCodeParser sourceCodeParser;
    private final RuleRegistry ruleRegistry;

    @Override
    public List<Problem> lint(String fileName, LintConfig config, byte[] source) throws SourceParseException {
        LintConfig effective = config != null ? config : LintConfig.defaults();

        // Step 1: Parse source code
        GoFile tree = sourceCodeParser.parse(fileName, source);
        log.debug("Parsed {}: package {}, {} declarations", fileName, tree.packageName(), tree.decls().size());

        // Step 2: Derive per-file state
        FileContext file = FileContext.of(fileName, source, tree, effective);
        ProblemCollector problems = new ProblemCollector(file);

        // Step 3: Evaluate rules
        for (RuleEvaluator evaluator : ruleRegistry.enabled(effective)) {
            int before = problems.size();
            evaluator.evaluate(file, problems);
            if (problems.size() > before) {
                log.debug("  {} found {} problems", evaluator.getName(), problems.size() - before);
            }
        }

        log.debug("Linted {}: {} problems", fileName, problems.size());
        return problems.problems();
    }
}

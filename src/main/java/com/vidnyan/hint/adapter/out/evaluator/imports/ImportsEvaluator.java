package com.vidnyan.hint.adapter.out.evaluator.imports;

import com.vidnyan.hint.domain.ast.Idents;
import com.vidnyan.hint.domain.ast.Spec.ImportSpec;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.lint.StyleGuide;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks import specs: no dot imports outside tests, and blank imports outside main and test
 * packages carry a comment justifying them.
 */
@Component
@Order(20)
public class ImportsEvaluator implements RuleEvaluator {

    private static final String DOT = ".";

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isImports();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        checkDotImports(file, problems);
        checkBlankImports(file, problems);
    }

    private void checkDotImports(FileContext file, ProblemCollector problems) {
        if (file.isTest()) {
            return;
        }
        for (ImportSpec imp : file.getTree().imports()) {
            if (imp.name() != null && DOT.equals(imp.name().name())) {
                problems.report(imp, 1, StyleGuide.IMPORT_DOT, Category.IMPORTS, "should not use dot imports");
            }
        }
    }

    /**
     * The first element of each contiguous group of blank imports should have an explanatory comment.
     */
    private void checkBlankImports(FileContext file, ProblemCollector problems) {
        if (file.isMainPackage() || file.isTest()) {
            return;
        }
        List<ImportSpec> imports = file.getTree().imports();
        for (int i = 0; i < imports.size(); i++) {
            ImportSpec imp = imports.get(i);
            if (!Idents.isBlank(imp.name())) {
                continue;
            }
            if (i > 0) {
                ImportSpec prev = imports.get(i - 1);
                int line = file.getLines().line(imp.pos());
                int prevLine = file.getLines().line(prev.pos());
                if (Idents.isBlank(prev.name()) && prevLine + 1 == line) {
                    // a subsequent blank in a group
                    continue;
                }
            }
            if (imp.doc() == null && imp.comment() == null) {
                problems.report(imp, 1, Category.IMPORTS,
                        "a blank import should be only in a main or test package, or have a comment justifying it");
            }
        }
    }
}

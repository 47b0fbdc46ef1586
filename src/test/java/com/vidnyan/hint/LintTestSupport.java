package com.vidnyan.hint;

import com.vidnyan.hint.adapter.out.evaluator.calls.IgnoredReturnEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.comments.ExportedEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.comments.PackageCommentEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.errors.ErrorStringEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.errors.ErrorVarEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.errors.ErrorfEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.idiom.ElseEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.idiom.IncDecEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.idiom.MakeSliceEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.idiom.RangeEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.idiom.VarDeclEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.imports.ImportsEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.naming.NamingEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.naming.ReceiverNameEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.signature.ErrorReturnEvaluator;
import com.vidnyan.hint.adapter.out.evaluator.signature.NamedReturnEvaluator;
import com.vidnyan.hint.adapter.out.parser.GoSourceParser;
import com.vidnyan.hint.application.port.out.SourceParseException;
import com.vidnyan.hint.application.service.LintApplicationService;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import com.vidnyan.hint.domain.rule.RuleRegistry;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared fixtures for tests that lint Go snippets end to end.
 */
public final class LintTestSupport {

    public static final String FILE_NAME = "x.go";

    private static final RuleRegistry REGISTRY = registry();

    private static final LintApplicationService SERVICE =
            new LintApplicationService(new GoSourceParser(), REGISTRY);

    private LintTestSupport() {
    }

    public static LintApplicationService service() {
        return SERVICE;
    }

    /**
     * The built-in evaluators without a Spring context, sorted by their {@code @Order} as the
     * context sorts them.
     */
    public static RuleRegistry registry() {
        List<RuleEvaluator> evaluators = new ArrayList<>(List.of(
                new NamedReturnEvaluator(),
                new IgnoredReturnEvaluator(),
                new ErrorReturnEvaluator(),
                new MakeSliceEvaluator(),
                new IncDecEvaluator(),
                new ReceiverNameEvaluator(),
                new ErrorStringEvaluator(),
                new ErrorVarEvaluator(),
                new ErrorfEvaluator(),
                new RangeEvaluator(),
                new ElseEvaluator(),
                new VarDeclEvaluator(),
                new NamingEvaluator(),
                new ExportedEvaluator(),
                new ImportsEvaluator(),
                new PackageCommentEvaluator()));
        AnnotationAwareOrderComparator.sort(evaluators);
        return new RuleRegistry(evaluators);
    }

    public static List<Problem> lint(String source, LintConfig config) throws SourceParseException {
        return lint(FILE_NAME, source, config);
    }

    public static List<Problem> lint(String fileName, String source, LintConfig config) throws SourceParseException {
        return SERVICE.lint(fileName, config, source.getBytes(StandardCharsets.UTF_8));
    }

    public static List<String> texts(List<Problem> problems) {
        return problems.stream().map(Problem::text).collect(Collectors.toList());
    }

    public static GoFile parse(String source) throws SourceParseException {
        return new GoSourceParser().parse(FILE_NAME, source.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * A configuration with every rule group off; enable the one under test on the returned builder.
     */
    public static LintConfig.LintConfigBuilder noRules() {
        return LintConfig.builder().noRules();
    }
}

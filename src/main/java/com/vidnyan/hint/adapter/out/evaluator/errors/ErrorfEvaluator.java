package com.vidnyan.hint.adapter.out.evaluator.errors;

import com.vidnyan.hint.domain.ast.Expr.CallExpr;
import com.vidnyan.hint.domain.ast.Idents;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Checks for {@code errors.New(fmt.Sprintf(...))}.
 */
@Component
@Order(80)
public class ErrorfEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isErrorChecks();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        file.walk(node -> {
            if (!(node instanceof CallExpr call)) {
                return true;
            }
            if (!Idents.isPkgDot(call.fun(), "errors", "New") || call.args().size() != 1) {
                return true;
            }
            if (call.args().get(0) instanceof CallExpr inner && Idents.isPkgDot(inner.fun(), "fmt", "Sprintf")) {
                problems.report(call, 1, Category.ERRORS,
                        "should replace errors.New(fmt.Sprintf(...)) with fmt.Errorf(...)");
            }
            return true;
        });
    }
}

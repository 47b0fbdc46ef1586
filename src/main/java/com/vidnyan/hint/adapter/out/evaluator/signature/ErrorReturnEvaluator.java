package com.vidnyan.hint.adapter.out.evaluator.signature;

import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.resolve.FunctionResults;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks that an error result comes last when a function returns several values.
 * Reported once per function.
 */
@Component
@Order(140)
public class ErrorReturnEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isErrorReturn();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        file.walk(node -> {
            if (!(node instanceof FuncDecl fn)) {
                return true;
            }
            int count = FunctionResults.count(fn.type());
            if (count <= 1) {
                return true;
            }
            List<Integer> errors = FunctionResults.errorPositions(fn.type());
            if (errors.stream().anyMatch(i -> i < count - 1)) {
                problems.report(fn, 0.9, Category.ARG_ORDER,
                        "error should be the last type when returning multiple items");
            }
            return true;
        });
    }
}

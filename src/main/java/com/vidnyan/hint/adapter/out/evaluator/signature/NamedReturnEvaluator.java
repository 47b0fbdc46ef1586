package com.vidnyan.hint.adapter.out.evaluator.signature;

import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Field;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Reports every named result of a function declaration.
 * Results are numbered from 0 in the order of the named ones.
 */
@Component
@Order(160)
public class NamedReturnEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isNamedReturn();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        file.walk(node -> {
            if (!(node instanceof FuncDecl fn) || fn.type().results() == null) {
                return true;
            }
            int i = 0;
            for (Field result : fn.type().results().list()) {
                for (Expr.Ident name : result.names()) {
                    problems.report(fn, 0.9, Category.NAMED_RETURN,
                            "return value #%d(\"%s\") should not be named", i, name.name());
                    i++;
                }
            }
            return true;
        });
    }
}

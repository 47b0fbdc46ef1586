package com.vidnyan.hint.adapter.out.evaluator.idiom;

import com.vidnyan.hint.domain.ast.Idents;
import com.vidnyan.hint.domain.ast.Stmt.AssignStmt;
import com.vidnyan.hint.domain.ast.Token;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Checks {@code x += 1} and {@code x -= 1}, which read better as {@code x++} and {@code x--}.
 */
@Component
@Order(120)
public class IncDecEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isIncDec();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        file.walk(node -> {
            if (!(node instanceof AssignStmt as) || as.lhs().size() != 1 || as.rhs().isEmpty()) {
                return true;
            }
            if (!Idents.isIntLit(as.rhs().get(0), "1")) {
                return true;
            }
            String suffix;
            if (as.tok() == Token.ADD_ASSIGN) {
                suffix = "++";
            } else if (as.tok() == Token.SUB_ASSIGN) {
                suffix = "--";
            } else {
                return true;
            }
            problems.report(as, 0.8, Category.UNARY_OP, "should replace %s with %s%s",
                    file.render(as), file.render(as.lhs().get(0)), suffix);
            return true;
        });
    }
}

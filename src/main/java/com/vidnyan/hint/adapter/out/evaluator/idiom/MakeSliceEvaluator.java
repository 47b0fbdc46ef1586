package com.vidnyan.hint.adapter.out.evaluator.idiom;

import com.vidnyan.hint.domain.ast.Expr;
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
 * Checks {@code x := make([]T, 0)}, where a nil slice declared with var would do.
 */
@Component
@Order(130)
public class MakeSliceEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isMakeSlice();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        file.walk(node -> {
            if (!(node instanceof AssignStmt as) || as.lhs().size() != 1 || as.tok() != Token.DEFINE) {
                return true;
            }
            if (!(as.rhs().get(0) instanceof Expr.CallExpr call)) {
                return true;
            }
            if (!Idents.isIdent(call.fun(), "make") || call.args().size() != 2
                    || !Idents.isIntLit(call.args().get(1), "0")) {
                return true;
            }
            if (!(call.args().get(0) instanceof Expr.ArrayType slice) || slice.len() != null) {
                return true;
            }
            problems.report(as, 0.8, Category.SLICE, "can probably use \"var %s %s\" instead",
                    file.render(as.lhs().get(0)), file.render(slice));
            return true;
        });
    }
}

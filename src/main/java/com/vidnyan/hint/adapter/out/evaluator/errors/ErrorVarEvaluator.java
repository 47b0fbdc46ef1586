package com.vidnyan.hint.adapter.out.evaluator.errors;

import com.vidnyan.hint.domain.ast.Decl;
import com.vidnyan.hint.domain.ast.Decl.GenDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Idents;
import com.vidnyan.hint.domain.ast.Spec;
import com.vidnyan.hint.domain.ast.Spec.ValueSpec;
import com.vidnyan.hint.domain.ast.Token;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Checks that package-level error variables are named errFoo or ErrFoo.
 */
@Component
@Order(90)
public class ErrorVarEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isErrorChecks();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        for (Decl decl : file.getTree().decls()) {
            if (!(decl instanceof GenDecl gen) || gen.tok() != Token.VAR) {
                continue;
            }
            for (Spec spec : gen.specs()) {
                if (spec instanceof ValueSpec vs) {
                    check(vs, problems);
                }
            }
        }
    }

    private void check(ValueSpec vs, ProblemCollector problems) {
        if (vs.names().size() != 1 || vs.values().size() != 1) {
            return;
        }
        if (!(vs.values().get(0) instanceof Expr.CallExpr call) || !isErrorConstructor(call.fun())) {
            return;
        }
        Expr.Ident id = vs.names().get(0);
        String prefix = id.isExported() ? "Err" : "err";
        if (!id.name().startsWith(prefix)) {
            problems.report(id, 0.9, Category.NAMING,
                    "error var %s should have name of the form %sFoo", id.name(), prefix);
        }
    }

    static boolean isErrorConstructor(Expr fun) {
        return Idents.isPkgDot(fun, "errors", "New") || Idents.isPkgDot(fun, "fmt", "Errorf");
    }
}

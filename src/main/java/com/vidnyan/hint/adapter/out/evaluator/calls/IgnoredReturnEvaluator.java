package com.vidnyan.hint.adapter.out.evaluator.calls;

import com.vidnyan.hint.domain.ast.AstWalker;
import com.vidnyan.hint.domain.ast.Decl;
import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Idents;
import com.vidnyan.hint.domain.ast.Stmt.AssignStmt;
import com.vidnyan.hint.domain.ast.Stmt.ExprStmt;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.resolve.FunctionResults;
import com.vidnyan.hint.domain.resolve.LocalFunctionResolver;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks calls to functions of this file whose results are dropped.
 * <p>
 * A bare call statement ignores results silently; an assignment of an error result to the
 * blank identifier ignores it on purpose. Calls that cannot be resolved to a declaration with
 * certainty are never reported.
 */
@Component
@Order(150)
public class IgnoredReturnEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isIgnoredReturn();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        LocalFunctionResolver functions = file.getFunctions();
        for (Decl decl : file.getTree().decls()) {
            Set<String> shadows = LocalFunctionResolver.boundNames(decl);
            AstWalker.walk(decl, node -> {
                if (node instanceof ExprStmt stmt) {
                    resolve(functions, stmt.x(), shadows).ifPresent(fn -> checkStatement(problems, stmt, fn));
                } else if (node instanceof AssignStmt as && as.rhs().size() == 1) {
                    resolve(functions, as.rhs().get(0), shadows).ifPresent(fn -> checkAssign(problems, as, fn));
                }
                return true;
            });
        }
    }

    private static Optional<FuncDecl> resolve(LocalFunctionResolver functions, Expr expr, Set<String> shadows) {
        if (!(expr instanceof Expr.CallExpr call)) {
            return Optional.empty();
        }
        return functions.resolve(call.fun(), shadows);
    }

    private void checkStatement(ProblemCollector problems, ExprStmt stmt, FuncDecl fn) {
        String name = fn.name().name();
        if (!FunctionResults.errorPositions(fn.type()).isEmpty()) {
            problems.report(stmt, 1, Category.RESULT_IGNORE,
                    "function '%s' returns an error, it should not be silently ignored", name);
        } else if (FunctionResults.count(fn.type()) > 0) {
            problems.report(stmt, 0.9, Category.RESULT_IGNORE,
                    "result of '%s' should not be silently ignored", name);
        }
    }

    private void checkAssign(ProblemCollector problems, AssignStmt as, FuncDecl fn) {
        // A count mismatch does not compile; leave it to the compiler.
        if (as.lhs().size() < FunctionResults.count(fn.type())) {
            return;
        }
        List<Integer> errors = FunctionResults.errorPositions(fn.type());
        for (int i : errors) {
            if (Idents.isBlank(as.lhs().get(i))) {
                problems.report(as, 0.8, Category.RESULT_IGNORE,
                        "function '%s' returns an error, generally it should not be intentionally ignored",
                        fn.name().name());
                return;
            }
        }
    }
}

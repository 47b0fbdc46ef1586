package com.vidnyan.hint.adapter.out.evaluator.idiom;

import com.vidnyan.hint.domain.ast.Stmt;
import com.vidnyan.hint.domain.ast.Stmt.IfStmt;
import com.vidnyan.hint.domain.ast.Token;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.lint.StyleGuide;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Checks else blocks whose if block ends in a return statement.
 * {@code if {} else if {} else {}} chains are left alone.
 */
@Component
@Order(60)
public class ElseEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isElses();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        // The if statement in an "else if" is visited after its parent; remember it so it is skipped.
        Set<IfStmt> ignore = Collections.newSetFromMap(new IdentityHashMap<>());

        file.walk(node -> {
            if (!(node instanceof IfStmt ifStmt) || ifStmt.elseStmt() == null) {
                return true;
            }
            if (ignore.contains(ifStmt)) {
                return true;
            }
            if (ifStmt.elseStmt() instanceof IfStmt elseIf) {
                ignore.add(elseIf);
                return true;
            }
            if (!(ifStmt.elseStmt() instanceof Stmt.BlockStmt)) {
                return true;
            }
            List<Stmt> body = ifStmt.body().list();
            if (body.isEmpty()) {
                return true;
            }
            boolean shortDecl = ifStmt.init() instanceof Stmt.AssignStmt as && as.tok() == Token.DEFINE;
            if (body.get(body.size() - 1) instanceof Stmt.ReturnStmt) {
                String extra = shortDecl ? " (move short variable declaration to its own line if necessary)" : "";
                problems.report(ifStmt.elseStmt(), 1, StyleGuide.INDENT_ERROR_FLOW, Category.INDENT,
                        "if block ends with a return statement, so drop this else and outdent its block" + extra);
            }
            return true;
        });
    }
}

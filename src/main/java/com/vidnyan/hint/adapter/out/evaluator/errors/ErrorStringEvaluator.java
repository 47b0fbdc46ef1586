package com.vidnyan.hint.adapter.out.evaluator.errors;

import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Literals;
import com.vidnyan.hint.domain.ast.Token;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.lint.StyleGuide;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Checks literal messages passed to errors.New and fmt.Errorf: no leading capital, no trailing
 * punctuation.
 * <p>
 * Error strings often start with proper nouns or exported identifiers, so capitalization is
 * reported with lower confidence, and not at all when the second rune is upper case too.
 */
@Component
@Order(100)
public class ErrorStringEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isErrorChecks();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        file.walk(node -> {
            if (!(node instanceof Expr.CallExpr call) || !ErrorVarEvaluator.isErrorConstructor(call.fun())) {
                return true;
            }
            if (call.args().isEmpty()) {
                return true;
            }
            if (!(call.args().get(0) instanceof Expr.BasicLit str) || str.kind() != Token.STRING) {
                return true;
            }
            String s = Literals.unquote(str.value()).orElse("");
            if (s.isEmpty()) {
                return true;
            }
            boolean cap = isCapitalized(s);
            boolean punct = endsWithPunctuation(s);
            String msg;
            if (cap && punct) {
                msg = "error strings should not be capitalized and should not end with punctuation";
            } else if (cap) {
                msg = "error strings should not be capitalized";
            } else if (punct) {
                msg = "error strings should not end with punctuation";
            } else {
                return true;
            }
            problems.report(str, cap ? 0.6 : 0.8, StyleGuide.ERROR_STRINGS, Category.ERRORS, msg);
            return true;
        });
    }

    static boolean isCapitalized(String s) {
        int first = s.codePointAt(0);
        if (!Character.isUpperCase(first)) {
            return false;
        }
        int next = Character.charCount(first);
        // Looks like an initialism.
        return next >= s.length() || !Character.isUpperCase(s.codePointAt(next));
    }

    static boolean endsWithPunctuation(String s) {
        int last = s.codePointBefore(s.length());
        return last == '.' || last == ':' || last == '!';
    }
}

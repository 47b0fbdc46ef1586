package com.vidnyan.hint.adapter.out.evaluator.idiom;

import com.vidnyan.hint.domain.ast.Idents;
import com.vidnyan.hint.domain.ast.Stmt.RangeStmt;
import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.FileContext;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.ProblemCollector;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Checks range clauses whose second variable is the blank identifier.
 */
@Component
@Order(70)
public class RangeEvaluator implements RuleEvaluator {

    @Override
    public boolean isEnabled(LintConfig config) {
        return config.isRangeLoops();
    }

    @Override
    public void evaluate(FileContext file, ProblemCollector problems) {
        file.walk(node -> {
            if (!(node instanceof RangeStmt rs)) {
                return true;
            }
            if (rs.value() == null || !Idents.isBlank(rs.value())) {
                return true;
            }
            problems.report(rs.value(), 1, Category.RANGE_LOOP,
                    "should omit 2nd value from range; this loop is equivalent to `for %s %s range ...`",
                    file.render(rs.key()), rs.tok().text());
            return true;
        });
    }
}

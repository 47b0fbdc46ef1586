package com.vidnyan.hint.adapter.out.evaluator.idiom;

import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.hint.LintTestSupport.lint;
import static com.vidnyan.hint.LintTestSupport.noRules;
import static com.vidnyan.hint.LintTestSupport.texts;
import static org.junit.jupiter.api.Assertions.*;

class RangeEvaluatorTest {

    private static final LintConfig CONFIG = noRules().rangeLoops(true).build();

    @Test
    void blankSecondValue_ShouldBeOmitted() throws Exception {
        String source = """
                package foo

                func f(m map[string]int) {
                	for k, _ := range m {
                		_ = k
                	}
                	var key string
                	for key, _ = range m {
                	}
                	for k, v := range m {
                		_, _ = k, v
                	}
                	for _, v := range m {
                		_ = v
                	}
                }
                """;

        List<Problem> problems = lint(source, CONFIG);

        assertEquals(List.of(
                "should omit 2nd value from range; this loop is equivalent to `for k := range ...`",
                "should omit 2nd value from range; this loop is equivalent to `for key = range ...`"),
                texts(problems));
        assertEquals(Category.RANGE_LOOP, problems.get(0).category());
        assertEquals(1.0, problems.get(0).confidence());
        assertEquals(4, problems.get(0).position().line());
        assertEquals(9, problems.get(0).position().column());
    }
}

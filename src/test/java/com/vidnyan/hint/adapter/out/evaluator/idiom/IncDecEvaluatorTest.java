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

class IncDecEvaluatorTest {

    @Test
    void addOrSubtractOne_ShouldUseIncDec() throws Exception {
        LintConfig config = noRules().incDec(true).build();
        String source = """
                package foo

                func f(x, y int, s []int) {
                	x += 1
                	y -= 1
                	s[x+1] += 1
                	x += 2
                	y *= 1
                	x, y = 1, 1
                }
                """;

        List<Problem> problems = lint(source, config);

        assertEquals(List.of(
                "should replace x += 1 with x++",
                "should replace y -= 1 with y--",
                "should replace s[x+1] += 1 with s[x+1]++"), texts(problems));
        assertEquals(Category.UNARY_OP, problems.get(0).category());
        assertEquals(0.8, problems.get(0).confidence());
    }
}

package com.vidnyan.hint.adapter.out.evaluator.idiom;

import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import com.vidnyan.hint.domain.lint.StyleGuide;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.hint.LintTestSupport.lint;
import static com.vidnyan.hint.LintTestSupport.noRules;
import static com.vidnyan.hint.LintTestSupport.texts;
import static org.junit.jupiter.api.Assertions.*;

class ElseEvaluatorTest {

    private static final LintConfig CONFIG = noRules().elses(true).build();

    @Test
    void elseAfterReturn_ShouldBeOutdented() throws Exception {
        String source = """
                package foo

                func f(x int) int {
                	if x > 0 {
                		return 1
                	} else {
                		return 2
                	}
                }

                func g(x int) int {
                	if y := x * 2; y > 0 {
                		return y
                	} else {
                		return -y
                	}
                }
                """;

        List<Problem> problems = lint(source, CONFIG);

        assertEquals(List.of(
                "if block ends with a return statement, so drop this else and outdent its block",
                "if block ends with a return statement, so drop this else and outdent its block "
                        + "(move short variable declaration to its own line if necessary)"), texts(problems));
        Problem first = problems.get(0);
        assertEquals(1.0, first.confidence());
        assertEquals(Category.INDENT, first.category());
        assertEquals(StyleGuide.INDENT_ERROR_FLOW, first.link());
        assertEquals(6, first.position().line());
    }

    @Test
    void elseIfChains_ShouldNeverBeReported() throws Exception {
        String source = """
                package foo

                func h(x int) int {
                	if x > 0 {
                		return 1
                	} else if x < 0 {
                		return -1
                	} else {
                		return 0
                	}
                }
                """;

        assertTrue(lint(source, CONFIG).isEmpty());
    }

    @Test
    void ifBlocksNotEndingInReturn_ShouldPass() throws Exception {
        String source = """
                package foo

                func k(x int) (n int) {
                	if x > 0 {
                		n = 1
                	} else {
                		n = 2
                	}
                	if x == 0 {
                	} else {
                		n = 3
                	}
                	return
                }
                """;

        assertTrue(lint(source, CONFIG).isEmpty());
    }
}

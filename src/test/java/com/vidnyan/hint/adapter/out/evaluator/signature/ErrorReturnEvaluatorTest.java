package com.vidnyan.hint.adapter.out.evaluator.signature;

import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.hint.LintTestSupport.lint;
import static com.vidnyan.hint.LintTestSupport.noRules;
import static org.junit.jupiter.api.Assertions.*;

class ErrorReturnEvaluatorTest {

    @Test
    void errorResult_ShouldComeLast() throws Exception {
        LintConfig config = noRules().errorReturn(true).build();
        String source = """
                package foo

                func a() (error, int)             { return nil, 0 }
                func b() (int, error)             { return 0, nil }
                func c() (x, y int, err error)    { return }
                func d() (err error, x, y int)    { return }
                func e() (error, error)           { return nil, nil }
                func f() error                    { return nil }
                func g() (int, string)            { return 0, "" }
                """;

        List<Problem> problems = lint(source, config);

        assertEquals(3, problems.size());
        assertEquals(List.of(3, 6, 7), problems.stream().map(p -> p.position().line()).toList());
        assertTrue(problems.stream().allMatch(p ->
                p.text().equals("error should be the last type when returning multiple items")
                        && p.category() == Category.ARG_ORDER
                        && p.confidence() == 0.9));
    }
}

package com.vidnyan.hint.adapter.out.evaluator.calls;

import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.hint.LintTestSupport.lint;
import static com.vidnyan.hint.LintTestSupport.noRules;
import static com.vidnyan.hint.LintTestSupport.texts;
import static org.junit.jupiter.api.Assertions.*;

class IgnoredReturnEvaluatorTest {

    private static final LintConfig CONFIG = noRules().ignoredReturn(true).build();

    private static final String DECLS = """
            package foo

            func mayFail() error           { return nil }
            func pair() (int, error)       { return 0, nil }
            func count() int               { return 0 }
            func nothing()                 {}
            func named() (n int, err error) { return }
            """;

    @Test
    void ignoredResults_ShouldBeReported() throws Exception {
        String source = DECLS + """

                func use() {
                	mayFail()
                	count()
                	nothing()
                	_, _ = pair()
                	n, _ := pair()
                	_ = n
                	_ = mayFail()
                	x, err := named()
                	_, _ = x, err
                }
                """;

        List<Problem> problems = lint(source, CONFIG);

        assertEquals(List.of(
                "function 'mayFail' returns an error, it should not be silently ignored",
                "result of 'count' should not be silently ignored",
                "function 'pair' returns an error, generally it should not be intentionally ignored",
                "function 'pair' returns an error, generally it should not be intentionally ignored",
                "function 'mayFail' returns an error, generally it should not be intentionally ignored"),
                texts(problems));
        assertEquals(List.of(1.0, 0.9, 0.8, 0.8, 0.8), problems.stream().map(Problem::confidence).toList());
        assertTrue(problems.stream().allMatch(p -> p.category() == Category.RESULT_IGNORE));
    }

    @Test
    void unresolvableCalls_ShouldNeverBeReported() throws Exception {
        String source = DECLS + """

                type T struct{}

                func (T) count() int { return 1 }

                func shadowedByParam(mayFail func() error) {
                	mayFail()
                }

                func shadowedByLocal() {
                	count := func() int { return 1 }
                	count()
                }

                func others(t T) {
                	t.count()
                	fmt.Println("x")
                	go mayFail()
                	defer mayFail()
                	_ = pair
                }

                var dup = 1

                func dup() int { return 0 }

                func callsDup() {
                	dup()
                }
                """;

        assertTrue(lint(source, CONFIG).isEmpty());
    }

    @Test
    void mismatchedAssignment_ShouldBeLeftToTheCompiler() throws Exception {
        String source = DECLS + """

                func mismatch() {
                	_ = pair()
                }
                """;

        assertTrue(lint(source, CONFIG).isEmpty());
    }

    @Test
    void lowerConfidenceResultIgnore_ShouldBeFiltered() throws Exception {
        LintConfig strict = noRules().ignoredReturn(true).minConfidence(0.95).build();
        String source = DECLS + "\nfunc use() {\n\tmayFail()\n\tcount()\n\t_ = mayFail()\n}\n";

        assertEquals(List.of("function 'mayFail' returns an error, it should not be silently ignored"),
                texts(lint(source, strict)));
    }
}

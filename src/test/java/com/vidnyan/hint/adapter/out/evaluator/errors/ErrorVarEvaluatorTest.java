package com.vidnyan.hint.adapter.out.evaluator.errors;

import com.vidnyan.hint.domain.lint.Category;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.hint.LintTestSupport.lint;
import static com.vidnyan.hint.LintTestSupport.noRules;
import static com.vidnyan.hint.LintTestSupport.texts;
import static org.junit.jupiter.api.Assertions.*;

class ErrorVarEvaluatorTest {

    private static final LintConfig CONFIG = noRules().errorChecks(true).build();

    @Test
    void packageErrorVars_ShouldBePrefixed() throws Exception {
        String source = """
                package foo

                var (
                	ErrMissing = errors.New("missing")
                	errHidden  = fmt.Errorf("hidden")
                	badThing   = errors.New("bad")
                	BadThing   = fmt.Errorf("bad")
                	notAnError = strings.New("x")
                )

                func f() error {
                	var local = errors.New("local")
                	return local
                }
                """;

        List<Problem> problems = lint(source, CONFIG);

        assertEquals(List.of(
                "error var badThing should have name of the form errFoo",
                "error var BadThing should have name of the form ErrFoo"), texts(problems));
        assertEquals(Category.NAMING, problems.get(0).category());
        assertEquals(0.9, problems.get(0).confidence());
    }
}

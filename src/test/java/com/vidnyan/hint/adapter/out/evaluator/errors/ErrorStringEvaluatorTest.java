package com.vidnyan.hint.adapter.out.evaluator.errors;

import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import com.vidnyan.hint.domain.lint.StyleGuide;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.hint.LintTestSupport.lint;
import static com.vidnyan.hint.LintTestSupport.noRules;
import static com.vidnyan.hint.LintTestSupport.texts;
import static org.junit.jupiter.api.Assertions.*;

class ErrorStringEvaluatorTest {

    private static final String SOURCE = """
            package foo

            func f() {
            	_ = errors.New("Something bad")
            	_ = errors.New("something bad.")
            	_ = fmt.Errorf("Bad thing: %v!", 1)
            	_ = errors.New("URL is bad")
            	_ = errors.New(`raw: fine`)
            	_ = errors.New("")
            	_ = log.New("Not an error.")
            }
            """;

    @Test
    void errorStrings_ShouldBeLowerCaseWithoutTrailingPunctuation() throws Exception {
        LintConfig config = noRules().errorChecks(true).minConfidence(0.5).build();

        List<Problem> problems = lint(SOURCE, config);

        assertEquals(List.of(
                "error strings should not be capitalized",
                "error strings should not end with punctuation",
                "error strings should not be capitalized and should not end with punctuation"), texts(problems));
        assertEquals(0.6, problems.get(0).confidence());
        assertEquals(0.8, problems.get(1).confidence());
        assertEquals(0.6, problems.get(2).confidence());
        assertEquals(StyleGuide.ERROR_STRINGS, problems.get(1).link());
    }

    @Test
    void capitalization_ShouldBeFilteredAtDefaultConfidence() throws Exception {
        LintConfig config = noRules().errorChecks(true).build();

        assertEquals(List.of("error strings should not end with punctuation"), texts(lint(SOURCE, config)));
    }

    @Test
    void isCapitalized_ShouldExemptInitialisms() {
        assertTrue(ErrorStringEvaluator.isCapitalized("Bad"));
        assertTrue(ErrorStringEvaluator.isCapitalized("B"));
        assertFalse(ErrorStringEvaluator.isCapitalized("EOF reached"));
        assertFalse(ErrorStringEvaluator.isCapitalized("bad"));
        assertTrue(ErrorStringEvaluator.isCapitalized("Über"));
    }

    @Test
    void endsWithPunctuation_ShouldOnlyConsiderPeriodColonAndBang() {
        assertTrue(ErrorStringEvaluator.endsWithPunctuation("done."));
        assertTrue(ErrorStringEvaluator.endsWithPunctuation("reason:"));
        assertTrue(ErrorStringEvaluator.endsWithPunctuation("oops!"));
        assertFalse(ErrorStringEvaluator.endsWithPunctuation("what?"));
        assertFalse(ErrorStringEvaluator.endsWithPunctuation("fine"));
    }
}

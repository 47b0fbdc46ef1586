package com.vidnyan.hint.adapter.out.evaluator.imports;

import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import com.vidnyan.hint.domain.lint.StyleGuide;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.hint.LintTestSupport.lint;
import static com.vidnyan.hint.LintTestSupport.noRules;
import static com.vidnyan.hint.LintTestSupport.texts;
import static org.junit.jupiter.api.Assertions.*;

class ImportsEvaluatorTest {

    private static final LintConfig CONFIG = noRules().imports(true).build();

    private static final String IMPORTS = """
            import (
            	. "fmt"
            	_ "image/png"
            	_ "image/gif"

            	// Register the jpeg decoder.
            	_ "image/jpeg"
            )
            """;

    @Test
    void libraryPackage_ShouldFlagDotImportAndFirstUncommentedBlankImport() throws Exception {
        List<Problem> problems = lint("package foo\n\n" + IMPORTS, CONFIG);

        assertEquals(List.of(
                "should not use dot imports",
                "a blank import should be only in a main or test package, or have a comment justifying it"),
                texts(problems));
        assertEquals(StyleGuide.IMPORT_DOT, problems.get(0).link());
        assertEquals(5, problems.get(1).position().line());
    }

    @Test
    void mainPackage_ShouldAllowBlankImports() throws Exception {
        List<Problem> problems = lint("package main\n\n" + IMPORTS, CONFIG);

        assertEquals(List.of("should not use dot imports"), texts(problems));
    }

    @Test
    void testFiles_ShouldAllowDotAndBlankImports() throws Exception {
        assertTrue(lint("foo_test.go", "package foo\n\n" + IMPORTS, CONFIG).isEmpty());
    }

    @Test
    void blankImportWithLineComment_ShouldPass() throws Exception {
        assertTrue(lint("package foo\n\nimport _ \"embed\" // for go:embed\n", CONFIG).isEmpty());
    }
}

package com.vidnyan.hint.domain.lint;

import com.vidnyan.hint.LintTestSupport;
import com.vidnyan.hint.domain.ast.GoFile;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProblemCollectorTest {

    private static final String SOURCE = "package p\n\nvar someName = 1\n";

    private ProblemCollector collector(double minConfidence) throws Exception {
        GoFile tree = LintTestSupport.parse(SOURCE);
        LintConfig config = LintConfig.builder().minConfidence(minConfidence).build();
        FileContext file = FileContext.of("p.go", SOURCE.getBytes(StandardCharsets.UTF_8), tree, config);
        return new ProblemCollector(file);
    }

    @Test
    void report_ShouldDropProblemsBelowMinimumConfidence() throws Exception {
        ProblemCollector problems = collector(0.5);
        GoFile tree = LintTestSupport.parse(SOURCE);

        problems.report(tree, 0.4, Category.COMMENTS, "too unsure");
        problems.report(tree, 0.5, Category.COMMENTS, "just enough");

        assertEquals(List.of("just enough"), LintTestSupport.texts(problems.problems()));
    }

    @Test
    void report_ShouldResolvePositionAndSourceLine() throws Exception {
        ProblemCollector problems = collector(0.8);
        GoFile tree = LintTestSupport.parse(SOURCE);
        var spec = ((com.vidnyan.hint.domain.ast.Decl.GenDecl) tree.decls().get(0)).specs().get(0);

        problems.report(spec, 1, StyleGuide.MIXED_CAPS, Category.NAMING, "name %s is %d", "someName", 8);

        Problem p = problems.problems().get(0);
        assertEquals("p.go", p.file());
        assertEquals(3, p.position().line());
        assertEquals(5, p.position().column());
        assertEquals("p.go:3:5", p.position().format());
        assertEquals("name someName is 8", p.text());
        assertEquals("var someName = 1\n", p.lineText());
        assertEquals(Category.NAMING, p.category());
        assertEquals(1.0, p.confidence());
        assertEquals("name someName is 8\n\n" + StyleGuide.MIXED_CAPS, p.render());
    }

    @Test
    void report_ShouldTreatEmptyLinkAsNoLink() throws Exception {
        ProblemCollector problems = collector(0.8);
        GoFile tree = LintTestSupport.parse(SOURCE);

        problems.report(tree, 1, "", Category.IMPORTS, "plain");

        Problem p = problems.problems().get(0);
        assertFalse(p.hasLink());
        assertEquals("plain", p.render());
    }
}

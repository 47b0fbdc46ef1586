package com.vidnyan.hint.domain.lint;

import com.vidnyan.hint.LintTestSupport;
import com.vidnyan.hint.domain.ast.Decl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.ast.Spec;
import com.vidnyan.hint.domain.ast.Stmt;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FileContextTest {

    private static final String SOURCE = """
            package main

            var handler = func(w Writer, r *Request) { w.Write(nil) }

            func (s *sorter) Len() int           { return 0 }
            func (s *sorter) Less(i, j int) bool { return false }
            func (s *sorter) Swap(i, j int)      {}

            func f(m map[string][]int) {
            	m["k"] = append(m["k"],
            		1)
            	x := 1
            	x += 1
            }
            """;

    private FileContext context(String fileName) throws Exception {
        GoFile tree = LintTestSupport.parse(SOURCE);
        return FileContext.of(fileName, SOURCE.getBytes(StandardCharsets.UTF_8), tree, LintConfig.defaults());
    }

    @Test
    void render_ShouldReturnSourceTextAsWritten() throws Exception {
        FileContext file = context("main.go");
        Decl.FuncDecl f = (Decl.FuncDecl) file.getTree().decls().get(4);

        assertEquals("map[string][]int", file.render(f.type().params().list().get(0).type()));
        assertEquals("m[\"k\"] = append(m[\"k\"],\n\t\t1)", file.render(f.body().list().get(0)));
        assertEquals("x += 1", file.render(f.body().list().get(2)));
        assertEquals("x", file.render(((Stmt.AssignStmt) f.body().list().get(2)).lhs().get(0)));
    }

    @Test
    void render_ShouldKeepFunctionLiteralBodies() throws Exception {
        FileContext file = context("main.go");
        Spec.ValueSpec spec = (Spec.ValueSpec) ((Decl.GenDecl) file.getTree().decls().get(0)).specs().get(0);

        assertEquals("func(w Writer, r *Request) { w.Write(nil) }", file.render(spec.values().get(0)));
    }

    @Test
    void render_ShouldRejectNodesFromOtherTrees() throws Exception {
        FileContext file = context("main.go");

        assertThrows(IllegalStateException.class, () -> file.render(new Expr.Ident(0, "main")));
    }

    @Test
    void of_ShouldDeriveFileFacts() throws Exception {
        FileContext file = context("main_test.go");

        assertTrue(file.isTest());
        assertTrue(file.isMainPackage());
        assertTrue(file.isSortable("sorter"));
        assertFalse(context("main.go").isTest());
    }
}

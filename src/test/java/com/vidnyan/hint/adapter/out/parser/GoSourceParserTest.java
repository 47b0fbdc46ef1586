package com.vidnyan.hint.adapter.out.parser;

import com.vidnyan.hint.application.port.out.SourceParseException;
import com.vidnyan.hint.domain.ast.Decl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.ast.Spec;
import com.vidnyan.hint.domain.ast.Stmt;
import com.vidnyan.hint.domain.ast.Token;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class GoSourceParserTest {

    private final GoSourceParser parser = new GoSourceParser();

    private GoFile parse(String source) throws SourceParseException {
        return parser.parse("t.go", source.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parse_ShouldReadPackageImportsAndDeclarations() throws Exception {
        GoFile file = parse("""
                package demo

                import (
                	"fmt"
                	_ "image/png" // register decoder
                )

                type T struct{ a, b int }

                func (t *T) Sum() int { return t.a + t.b }

                func main() { fmt.Println(1) }
                """);

        assertEquals("demo", file.packageName());
        assertEquals(2, file.imports().size());
        assertEquals("\"fmt\"", file.imports().get(0).path().value());
        Spec.ImportSpec blank = file.imports().get(1);
        assertEquals("_", blank.name().name());
        assertNotNull(blank.comment());
        assertEquals("register decoder\n", blank.comment().text());
        assertEquals(4, file.decls().size());
        assertTrue(file.decls().get(2) instanceof Decl.FuncDecl fn && fn.isMethod());
    }

    @Test
    void parse_ShouldAttachDocComments() throws Exception {
        GoFile file = parse("""
                // Package demo is a demo.
                package demo

                // F does things.
                func F() {}

                // detached

                func G() {}

                // Grouped values.
                const (
                	// A is first.
                	A = 1
                	B = 2 // second
                )
                """);

        assertEquals("Package demo is a demo.\n", file.doc().text());
        Decl.FuncDecl f = (Decl.FuncDecl) file.decls().get(0);
        assertEquals("F does things.\n", f.doc().text());
        Decl.FuncDecl g = (Decl.FuncDecl) file.decls().get(1);
        assertNull(g.doc());

        Decl.GenDecl consts = (Decl.GenDecl) file.decls().get(2);
        assertEquals(Token.CONST, consts.tok());
        assertTrue(consts.isGrouped());
        assertEquals("Grouped values.\n", consts.doc().text());
        Spec.ValueSpec a = (Spec.ValueSpec) consts.specs().get(0);
        Spec.ValueSpec b = (Spec.ValueSpec) consts.specs().get(1);
        assertEquals("A is first.\n", a.doc().text());
        assertNull(b.doc());
        assertEquals("second\n", b.comment().text());
        assertEquals(6, file.comments().size());
    }

    @Test
    void parse_ShouldNotTreatCommentSeparatedByBlankLineAsPackageDoc() throws Exception {
        GoFile file = parse("// Copyright notice.\n\npackage demo\n");

        assertNull(file.doc());
        assertEquals(1, file.comments().size());
    }

    @Test
    void parse_ShouldResolveCompositeLiteralAmbiguity() throws Exception {
        GoFile file = parse("""
                package demo

                func f(x T) {
                	if x == (T{}) {
                	}
                	for _, v := range []int{1, 2} {
                		_ = v
                	}
                	switch y := x.(type) {
                	case nil:
                		_ = y
                	}
                }
                """);

        Decl.FuncDecl f = (Decl.FuncDecl) file.decls().get(0);
        assertTrue(f.body().list().get(0) instanceof Stmt.IfStmt);
        Stmt.RangeStmt range = (Stmt.RangeStmt) f.body().list().get(1);
        assertEquals(Token.DEFINE, range.tok());
        assertTrue(range.x() instanceof Expr.CompositeLit);
        assertTrue(f.body().list().get(2) instanceof Stmt.TypeSwitchStmt);
    }

    @Test
    void parse_ShouldInsertSemicolonsAtLineEnds() throws Exception {
        GoFile file = parse("package demo\nfunc f() {\n\tx := 1\n\tx++\n\treturn\n}\n");

        Decl.FuncDecl f = (Decl.FuncDecl) file.decls().get(0);
        assertEquals(3, f.body().list().size());
        assertTrue(f.body().list().get(1) instanceof Stmt.IncDecStmt);
    }

    @Test
    void parse_ShouldReportSyntaxErrorsWithPosition() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> parse("package demo\n\nfunc f( {\n}\n"));

        assertEquals("t.go", e.getFileName());
        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().startsWith("t.go:3:"));
    }

    @Test
    void parse_ShouldRequirePackageClause() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> parse("func f() {}\n"));

        assertEquals(1, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void parse_ShouldRejectInvalidCharacters() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> parse("package demo\nvar x = 1 @ 2\n"));

        assertEquals(2, e.getLine());
    }

    @Test
    void parse_ShouldReadTypeParameters() throws Exception {
        GoFile file = parse("""
                package demo

                type Number interface {
                	~int | ~float64
                }

                type List[T any] struct{ v T }

                type Pair[K comparable, V any] struct {
                	k K
                	v V
                }

                func Map[T any](xs []T) []T { return xs }

                func (l *List[T]) Get() T { return l.v }

                func use() {
                	_ = Map[int](nil)
                	var p Pair[string, int]
                	_ = p
                }
                """);

        Spec.TypeSpec number = (Spec.TypeSpec) ((Decl.GenDecl) file.decls().get(0)).specs().get(0);
        Expr.InterfaceType iface = (Expr.InterfaceType) number.type();
        Expr.BinaryExpr union = (Expr.BinaryExpr) iface.methods().list().get(0).type();
        assertEquals(Token.OR, union.op());
        assertEquals(Token.TILDE, ((Expr.UnaryExpr) union.x()).op());

        Spec.TypeSpec list = (Spec.TypeSpec) ((Decl.GenDecl) file.decls().get(1)).specs().get(0);
        assertEquals("T", list.typeParams().list().get(0).names().get(0).name());
        Spec.TypeSpec pair = (Spec.TypeSpec) ((Decl.GenDecl) file.decls().get(2)).specs().get(0);
        assertEquals(2, pair.typeParams().arity());

        Decl.FuncDecl map = (Decl.FuncDecl) file.decls().get(3);
        assertEquals("Map", map.name().name());
        assertEquals(1, map.type().typeParams().arity());
        assertEquals(1, map.type().params().arity());

        Decl.FuncDecl get = (Decl.FuncDecl) file.decls().get(4);
        Expr.StarExpr recv = (Expr.StarExpr) get.recv().list().get(0).type();
        assertTrue(recv.x() instanceof Expr.IndexExpr);

        Decl.FuncDecl use = (Decl.FuncDecl) file.decls().get(5);
        Stmt.AssignStmt call = (Stmt.AssignStmt) use.body().list().get(0);
        Expr.CallExpr mapCall = (Expr.CallExpr) call.rhs().get(0);
        assertTrue(mapCall.fun() instanceof Expr.IndexExpr);
        Spec.ValueSpec p = (Spec.ValueSpec) ((Stmt.DeclStmt) use.body().list().get(1)).decl().specs().get(0);
        assertEquals(2, ((Expr.IndexListExpr) p.type()).indices().size());
    }

    @Test
    void parse_ShouldAcceptModerateNesting() throws Exception {
        GoFile file = parse("package demo\nvar x = " + "(".repeat(100) + "1" + ")".repeat(100) + "\n");

        assertEquals(1, file.decls().size());
    }

    @Test
    void parse_ShouldRejectDeeplyNestedExpressions() {
        String source = "package demo\nvar x = " + "(".repeat(20000) + "1" + ")".repeat(20000) + "\n";

        SourceParseException e = assertThrows(SourceParseException.class, () -> parse(source));

        assertEquals("t.go", e.getFileName());
    }

    @Test
    void parse_ShouldRejectDeeplyNestedBlocks() {
        String source = "package demo\nfunc f() " + "{".repeat(20000) + "}".repeat(20000) + "\n";

        assertThrows(SourceParseException.class, () -> parse(source));
    }

    @Test
    void parse_ShouldRejectIllegalUtf8() {
        byte[] source = {'p', 'a', 'c', 'k', 'a', 'g', 'e', ' ', 'x', '\n', '/', '/', ' ', (byte) 0xff, '\n'};

        SourceParseException e = assertThrows(SourceParseException.class, () -> parser.parse("t.go", source));

        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().endsWith("illegal UTF-8 encoding"));
    }

    @Test
    void parse_ShouldKeepOffsetsAfterByteOrderMark() throws Exception {
        GoFile file = parse("\uFEFFpackage demo\n");

        assertEquals("demo", file.packageName());
        assertEquals(3, file.pos());
    }

    @Test
    void parse_ShouldRejectImportsAfterDeclarations() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> parse("package demo\n\nvar x = 1\n\nimport \"fmt\"\n"));

        assertEquals(5, e.getLine());
        assertTrue(e.getMessage().endsWith("imports must appear before other declarations"));
    }

    @Test
    void parse_ShouldRequireCallInGoStatement() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> parse("package demo\nfunc f(x int) {\n\tgo x\n}\n"));

        assertEquals(3, e.getLine());
    }

    @Test
    void parse_ShouldRecordSourceRangesOfExpressions() throws Exception {
        String source = "package demo\nvar x = a  +  b // keep spacing\n";
        GoFile file = parse(source);

        Spec.ValueSpec spec = (Spec.ValueSpec) ((Decl.GenDecl) file.decls().get(0)).specs().get(0);
        Expr value = spec.values().get(0);

        assertEquals("a  +  b", file.spans().text(source.getBytes(StandardCharsets.UTF_8), value));
        assertEquals("keep spacing\n", spec.comment().text());
    }
}

package com.vidnyan.hint.domain.ast;

/**
 * Small predicates over identifiers and expressions shared by the rules.
 */
public final class Idents {

    public static final String BLANK = "_";

    private Idents() {
    }

    /**
     * Go's export rule: the first rune is an upper case letter.
     */
    public static boolean isExported(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.codePointAt(0));
    }

    public static boolean isIdent(Node node, String name) {
        return node instanceof Expr.Ident id && id.name().equals(name);
    }

    public static boolean isBlank(Node node) {
        return isIdent(node, BLANK);
    }

    /**
     * Whether the expression is the selector {@code pkg.name}.
     */
    public static boolean isPkgDot(Expr expr, String pkg, String name) {
        return expr instanceof Expr.SelectorExpr sel && isIdent(sel.x(), pkg) && isIdent(sel.sel(), name);
    }

    public static boolean isIntLit(Node node, String value) {
        return node instanceof Expr.BasicLit lit && lit.kind() == Token.INT && lit.value().equals(value);
    }
}

package com.vidnyan.hint.domain.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * Lexical tokens of the Go language.
 */
public enum Token {
    IDENT("IDENT"),
    INT("INT"),
    FLOAT("FLOAT"),
    IMAG("IMAG"),
    CHAR("CHAR"),
    STRING("STRING"),

    ADD("+"),
    SUB("-"),
    MUL("*"),
    QUO("/"),
    REM("%"),
    AND("&"),
    OR("|"),
    XOR("^"),
    SHL("<<"),
    SHR(">>"),
    AND_NOT("&^"),

    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    QUO_ASSIGN("/="),
    REM_ASSIGN("%="),
    AND_ASSIGN("&="),
    OR_ASSIGN("|="),
    XOR_ASSIGN("^="),
    SHL_ASSIGN("<<="),
    SHR_ASSIGN(">>="),
    AND_NOT_ASSIGN("&^="),

    LAND("&&"),
    LOR("||"),
    ARROW("<-"),
    INC("++"),
    DEC("--"),

    EQL("=="),
    LSS("<"),
    GTR(">"),
    ASSIGN("="),
    NOT("!"),
    NEQ("!="),
    LEQ("<="),
    GEQ(">="),
    DEFINE(":="),
    ELLIPSIS("..."),
    TILDE("~"),

    LPAREN("("),
    LBRACK("["),
    LBRACE("{"),
    COMMA(","),
    PERIOD("."),
    RPAREN(")"),
    RBRACK("]"),
    RBRACE("}"),
    SEMICOLON(";"),
    COLON(":"),

    BREAK("break"),
    CASE("case"),
    CHAN("chan"),
    CONST("const"),
    CONTINUE("continue"),
    DEFAULT("default"),
    DEFER("defer"),
    ELSE("else"),
    FALLTHROUGH("fallthrough"),
    FOR("for"),
    FUNC("func"),
    GO("go"),
    GOTO("goto"),
    IF("if"),
    IMPORT("import"),
    INTERFACE("interface"),
    MAP("map"),
    PACKAGE("package"),
    RANGE("range"),
    RETURN("return"),
    SELECT("select"),
    STRUCT("struct"),
    SWITCH("switch"),
    TYPE("type"),
    VAR("var");

    private static final Map<String, Token> BY_TEXT = new HashMap<>();

    static {
        for (Token t : values()) {
            if (!t.isLiteral()) {
                BY_TEXT.put(t.text, t);
            }
        }
    }

    private final String text;

    Token(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public boolean isLiteral() {
        return ordinal() <= STRING.ordinal();
    }

    /**
     * The operator, delimiter or keyword spelled {@code text}.
     * @throws IllegalArgumentException for anything else
     */
    public static Token fromText(String text) {
        Token t = BY_TEXT.get(text);
        if (t == null) {
            throw new IllegalArgumentException("not a Go operator or keyword: " + text);
        }
        return t;
    }

    @Override
    public String toString() {
        return text;
    }
}

package com.vidnyan.hint.domain.lint;

/**
 * Short names for the general category of a problem.
 */
public enum Category {
    COMMENTS("comments"),
    IMPORTS("imports"),
    NAMING("naming"),
    ZERO_VALUE("zero-value"),
    TYPE_INFERENCE("type-inference"),
    INDENT("indent"),
    RANGE_LOOP("range-loop"),
    ERRORS("errors"),
    UNARY_OP("unary-op"),
    SLICE("slice"),
    ARG_ORDER("arg-order"),
    RESULT_IGNORE("result-ignore"),
    NAMED_RETURN("named-return");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}

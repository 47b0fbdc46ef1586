package com.vidnyan.hint.domain.ast;

import java.util.List;

/**
 * Fields enclosed by parentheses or braces. Single unparenthesized results have no opening.
 */
public record FieldList(int opening, List<Field> list) implements Node {

    @Override
    public int pos() {
        if (opening >= 0 || list.isEmpty()) {
            return opening;
        }
        return list.get(0).pos();
    }

    /**
     * Number of declared values, counting each name of a multi-name field.
     */
    public int arity() {
        int n = 0;
        for (Field f : list) {
            n += f.arity();
        }
        return n;
    }

    @Override
    public List<Node> children() {
        return Node.childrenOf(list);
    }
}

package com.vidnyan.hint.domain.ast;

import java.util.List;

/**
 * A parameter, result, struct field or interface method. Names are empty for anonymous fields.
 */
public record Field(
    CommentGroup doc,
    List<Expr.Ident> names,
    Expr type,
    Expr.BasicLit tag,
    CommentGroup comment
) implements Node {

    @Override
    public int pos() {
        return names.isEmpty() ? type.pos() : names.get(0).pos();
    }

    /**
     * Number of values the field declares: one per name, or one if anonymous.
     */
    public int arity() {
        return names.isEmpty() ? 1 : names.size();
    }

    @Override
    public List<Node> children() {
        return Node.childrenOf(doc, names, type, tag, comment);
    }
}

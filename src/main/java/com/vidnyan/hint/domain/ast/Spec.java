package com.vidnyan.hint.domain.ast;

import java.util.List;

/**
 * Specs inside a {@link Decl.GenDecl}.
 */
public interface Spec extends Node {

    /**
     * The local name is null when the import is not renamed; {@code .} and {@code _} are idents.
     */
    record ImportSpec(CommentGroup doc, Expr.Ident name, Expr.BasicLit path, CommentGroup comment)
            implements Spec {

        @Override
        public int pos() {
            return name != null ? name.pos() : path.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(doc, name, path, comment);
        }
    }

    /**
     * A const or var spec; type may be null and values may be empty.
     */
    record ValueSpec(CommentGroup doc, List<Expr.Ident> names, Expr type, List<Expr> values, CommentGroup comment)
            implements Spec {

        @Override
        public int pos() {
            return names.get(0).pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(doc, names, type, values, comment);
        }
    }

    /**
     * typeParams is null unless the type is generic.
     */
    record TypeSpec(CommentGroup doc, Expr.Ident name, FieldList typeParams, boolean alias, Expr type,
                    CommentGroup comment) implements Spec {

        @Override
        public int pos() {
            return name.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(doc, name, typeParams, type, comment);
        }
    }
}

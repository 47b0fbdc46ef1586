package com.vidnyan.hint.domain.ast;

import java.util.List;

/**
 * Top-level declarations.
 */
public interface Decl extends Node {

    /**
     * An import, const, type or var declaration; lparen is -1 when the specs are not parenthesized.
     */
    record GenDecl(CommentGroup doc, int pos, Token tok, int lparen, List<Spec> specs) implements Decl {

        public boolean isGrouped() {
            return lparen >= 0;
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(doc, specs);
        }
    }

    /**
     * A function or method declaration; recv is null for functions, body is null for external functions.
     */
    record FuncDecl(CommentGroup doc, FieldList recv, Expr.Ident name, Expr.FuncType type, Stmt.BlockStmt body)
            implements Decl {

        @Override
        public int pos() {
            return type.pos();
        }

        public boolean isMethod() {
            return recv != null;
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(doc, recv, name, type, body);
        }
    }
}

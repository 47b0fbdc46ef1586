package com.vidnyan.hint.domain.ast;

import java.util.List;

/**
 * Expression and type nodes. Types are expressions in Go's grammar, so both share this interface.
 */
public interface Expr extends Node {

    record Ident(int pos, String name) implements Expr {

        public boolean isBlank() {
            return "_".equals(name);
        }

        /**
         * Whether the name starts with an upper case letter.
         */
        public boolean isExported() {
            return Idents.isExported(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A literal of kind INT, FLOAT, IMAG, CHAR or STRING, value as written in the source.
     */
    record BasicLit(int pos, Token kind, String value) implements Expr {}

    /**
     * {@code Type{elts}}; the type is null for elided inner literals.
     */
    record CompositeLit(Expr type, int lbrace, List<Expr> elts) implements Expr {
        @Override
        public int pos() {
            return type != null ? type.pos() : lbrace;
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(type, elts);
        }
    }

    record FuncLit(FuncType type, Stmt.BlockStmt body) implements Expr {
        @Override
        public int pos() {
            return type.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(type, body);
        }
    }

    record ParenExpr(int pos, Expr x) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(x);
        }
    }

    record SelectorExpr(Expr x, Ident sel) implements Expr {
        @Override
        public int pos() {
            return x.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(x, sel);
        }
    }

    record IndexExpr(Expr x, Expr index) implements Expr {
        @Override
        public int pos() {
            return x.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(x, index);
        }
    }

    /**
     * Instantiation with several type arguments, {@code x[A, B]}.
     */
    record IndexListExpr(Expr x, List<Expr> indices) implements Expr {
        @Override
        public int pos() {
            return x.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(x, indices);
        }
    }

    record SliceExpr(Expr x, Expr low, Expr high, Expr max, boolean slice3) implements Expr {
        @Override
        public int pos() {
            return x.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(x, low, high, max);
        }
    }

    /**
     * {@code x.(T)}; the type is null for the {@code x.(type)} switch guard.
     */
    record TypeAssertExpr(Expr x, Expr type) implements Expr {
        @Override
        public int pos() {
            return x.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(x, type);
        }
    }

    record CallExpr(Expr fun, List<Expr> args, boolean ellipsis) implements Expr {
        @Override
        public int pos() {
            return fun.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(fun, args);
        }
    }

    /**
     * Pointer type or dereference.
     */
    record StarExpr(int pos, Expr x) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(x);
        }
    }

    record UnaryExpr(int pos, Token op, Expr x) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(x);
        }
    }

    record BinaryExpr(Expr x, Token op, Expr y) implements Expr {
        @Override
        public int pos() {
            return x.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(x, y);
        }
    }

    record KeyValueExpr(Expr key, Expr value) implements Expr {
        @Override
        public int pos() {
            return key.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(key, value);
        }
    }

    /**
     * {@code [len]elt}; len is null for slices and an {@link Ellipsis} for {@code [...]T}.
     */
    record ArrayType(int pos, Expr len, Expr elt) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(len, elt);
        }
    }

    record StructType(int pos, FieldList fields) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(fields);
        }
    }

    /**
     * Function signature; typeParams is null for non-generic functions, results is null when the
     * function returns nothing.
     */
    record FuncType(int pos, FieldList typeParams, FieldList params, FieldList results) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(typeParams, params, results);
        }
    }

    record InterfaceType(int pos, FieldList methods) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(methods);
        }
    }

    record MapType(int pos, Expr key, Expr value) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(key, value);
        }
    }

    record ChanType(int pos, ChanDir dir, Expr value) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(value);
        }
    }

    enum ChanDir { BOTH, SEND, RECV }

    /**
     * {@code ...T} in parameter lists, or {@code ...} in array lengths (elt is null).
     */
    record Ellipsis(int pos, Expr elt) implements Expr {
        @Override
        public List<Node> children() {
            return Node.childrenOf(elt);
        }
    }
}

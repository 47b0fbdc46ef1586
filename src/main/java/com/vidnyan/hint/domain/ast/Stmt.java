package com.vidnyan.hint.domain.ast;

import java.util.List;

/**
 * Statement nodes.
 */
public interface Stmt extends Node {

    /**
     * A const, type or var declaration inside a function body.
     */
    record DeclStmt(Decl.GenDecl decl) implements Stmt {
        @Override
        public int pos() {
            return decl.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(decl);
        }
    }

    record EmptyStmt(int pos, boolean implicit) implements Stmt {}

    record LabeledStmt(Expr.Ident label, Stmt stmt) implements Stmt {
        @Override
        public int pos() {
            return label.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(label, stmt);
        }
    }

    record ExprStmt(Expr x) implements Stmt {
        @Override
        public int pos() {
            return x.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(x);
        }
    }

    record SendStmt(Expr chan, Expr value) implements Stmt {
        @Override
        public int pos() {
            return chan.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(chan, value);
        }
    }

    record IncDecStmt(Expr x, Token tok) implements Stmt {
        @Override
        public int pos() {
            return x.pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(x);
        }
    }

    /**
     * Assignment or short variable declaration; tok is {@code =}, {@code :=} or an op-assign.
     */
    record AssignStmt(List<Expr> lhs, Token tok, List<Expr> rhs) implements Stmt {
        @Override
        public int pos() {
            return lhs.get(0).pos();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(lhs, rhs);
        }
    }

    record GoStmt(int pos, Expr call) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(call);
        }
    }

    record DeferStmt(int pos, Expr call) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(call);
        }
    }

    record ReturnStmt(int pos, List<Expr> results) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(results);
        }
    }

    /**
     * break, continue, goto or fallthrough, with an optional label.
     */
    record BranchStmt(int pos, Token tok, Expr.Ident label) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(label);
        }
    }

    record BlockStmt(int pos, List<Stmt> list) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(list);
        }
    }

    /**
     * The else branch is null, a {@link BlockStmt} or another {@link IfStmt}.
     */
    record IfStmt(int pos, Stmt init, Expr cond, BlockStmt body, Stmt elseStmt) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(init, cond, body, elseStmt);
        }
    }

    /**
     * A case of an expression or type switch; an empty list is the default case.
     */
    record CaseClause(int pos, List<Expr> list, List<Stmt> body) implements Stmt {
        public boolean isDefault() {
            return list.isEmpty();
        }

        @Override
        public List<Node> children() {
            return Node.childrenOf(list, body);
        }
    }

    record SwitchStmt(int pos, Stmt init, Expr tag, BlockStmt body) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(init, tag, body);
        }
    }

    record TypeSwitchStmt(int pos, Stmt init, Stmt assign, BlockStmt body) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(init, assign, body);
        }
    }

    /**
     * A select case; comm is null for the default case.
     */
    record CommClause(int pos, Stmt comm, List<Stmt> body) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(comm, body);
        }
    }

    record SelectStmt(int pos, BlockStmt body) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(body);
        }
    }

    record ForStmt(int pos, Stmt init, Expr cond, Stmt post, BlockStmt body) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(init, cond, post, body);
        }
    }

    /**
     * {@code for key, value := range x}; key and value may be null, tok is null when both are.
     */
    record RangeStmt(int pos, Expr key, Expr value, Token tok, Expr x, BlockStmt body) implements Stmt {
        @Override
        public List<Node> children() {
            return Node.childrenOf(key, value, x, body);
        }
    }
}

package com.vidnyan.hint.domain.resolve;

import com.vidnyan.hint.domain.ast.Decl.FuncDecl;
import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Field;

import java.util.Optional;

/**
 * Determines the base type name of a method receiver.
 */
public final class ReceiverTypes {

    private ReceiverTypes() {
    }

    /**
     * The receiver's type name for {@code T} and {@code *T} receivers, including generic ones
     * such as {@code *List[T]}.
     * Empty for functions and for receiver shapes that cannot be reduced to a name,
     * in which case rules depending on the receiver type skip the declaration.
     */
    public static Optional<String> of(FuncDecl fn) {
        if (fn.recv() == null || fn.recv().list().isEmpty()) {
            return Optional.empty();
        }
        Expr type = fn.recv().list().get(0).type();
        while (type instanceof Expr.ParenExpr paren) {
            type = paren.x();
        }
        if (type instanceof Expr.StarExpr star) {
            type = star.x();
        }
        if (type instanceof Expr.IndexExpr index) {
            type = index.x();
        } else if (type instanceof Expr.IndexListExpr indices) {
            type = indices.x();
        }
        if (type instanceof Expr.Ident id) {
            return Optional.of(id.name());
        }
        return Optional.empty();
    }

    /**
     * The declared receiver name, if the receiver is named.
     */
    public static Optional<Expr.Ident> receiverName(FuncDecl fn) {
        if (fn.recv() == null || fn.recv().list().isEmpty()) {
            return Optional.empty();
        }
        Field recv = fn.recv().list().get(0);
        return recv.names().isEmpty() ? Optional.empty() : Optional.of(recv.names().get(0));
    }
}

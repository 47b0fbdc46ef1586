package com.vidnyan.hint.domain.resolve;

import com.vidnyan.hint.domain.ast.Expr;
import com.vidnyan.hint.domain.ast.Field;
import com.vidnyan.hint.domain.ast.FieldList;
import com.vidnyan.hint.domain.ast.Idents;

import java.util.ArrayList;
import java.util.List;

/**
 * Result-list inspection for function signatures.
 * Positions are flattened: {@code (a, b int, err error)} has three positions and {@code err} is at 2.
 */
public final class FunctionResults {

    private static final String ERROR_TYPE = "error";

    private FunctionResults() {
    }

    public static int count(Expr.FuncType type) {
        return type.results() == null ? 0 : type.results().arity();
    }

    /**
     * Positions whose declared type is the bare identifier {@code error}.
     * Locally declared error types are not recognised.
     */
    public static List<Integer> errorPositions(Expr.FuncType type) {
        List<Integer> positions = new ArrayList<>();
        FieldList results = type.results();
        if (results == null) {
            return positions;
        }
        int index = 0;
        for (Field field : results.list()) {
            boolean isError = Idents.isIdent(field.type(), ERROR_TYPE);
            for (int i = 0; i < field.arity(); i++) {
                if (isError) {
                    positions.add(index);
                }
                index++;
            }
        }
        return positions;
    }
}

package com.vidnyan.hint.domain.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A node of the Go syntax tree.
 * Positions are byte offsets into the source the tree was parsed from.
 */
public interface Node {

    /**
     * Byte offset of the first character belonging to the node.
     */
    int pos();

    /**
     * Direct children in source order. Absent optional parts are skipped.
     */
    default List<Node> children() {
        return List.of();
    }

    /**
     * Flattens single nodes and node collections into a child list, dropping nulls.
     */
    static List<Node> childrenOf(Object... parts) {
        List<Node> out = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                out.add(node);
            } else if (part instanceof Collection<?> many) {
                for (Object o : many) {
                    if (o instanceof Node node) {
                        out.add(node);
                    }
                }
            }
        }
        return out;
    }
}

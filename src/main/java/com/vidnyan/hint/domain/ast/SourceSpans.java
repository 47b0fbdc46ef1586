package com.vidnyan.hint.domain.ast;

import java.nio.charset.StandardCharsets;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * End offsets of the nodes of one parsed file, so a node's text can be cut back out of the source.
 * Keyed by node identity: structurally equal nodes at different places have different spans.
 */
public final class SourceSpans {

    private final Map<Node, Integer> ends = new IdentityHashMap<>();

    public void record(Node node, int end) {
        ends.put(node, end);
    }

    /**
     * The source text of the node, exactly as written.
     * @throws IllegalStateException if the node was not produced by the parser of this file
     */
    public String text(byte[] source, Node node) {
        Integer end = ends.get(node);
        if (end == null || end < node.pos() || end > source.length) {
            throw new IllegalStateException("no source range for " + node.getClass().getSimpleName());
        }
        return new String(source, node.pos(), end - node.pos(), StandardCharsets.UTF_8);
    }

    public int size() {
        return ends.size();
    }
}

package com.vidnyan.hint.domain.ast;

/**
 * Callback for {@link AstWalker}.
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * Visits a node before its children.
     *
     * @return true to descend into the node's children, false to skip them
     */
    boolean visit(Node node);
}

package com.vidnyan.hint.domain.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Pre-order, depth-first traversal of a syntax tree.
 * Children are visited in source order; a visitor returning false prunes that node's subtree only.
 */
public final class AstWalker {

    private AstWalker() {
    }

    public static void walk(Node root, NodeVisitor visitor) {
        if (root == null) {
            return;
        }
        // explicit stack keeps deeply nested expressions off the call stack
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (!visitor.visit(node)) {
                continue;
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }
}

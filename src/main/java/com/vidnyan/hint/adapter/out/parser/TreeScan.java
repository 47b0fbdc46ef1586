package com.vidnyan.hint.adapter.out.parser;

import com.vidnyan.hint.domain.ast.CommentGroup;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.ATOMIC;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.COMMENT;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.end;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.found;
import static com.vidnyan.hint.adapter.out.parser.TreeSitterNodes.start;

/**
 * A single iterative pass over a tree-sitter tree in document order. Collects the tokens and
 * comments that comment attachment needs, and rejects trees with syntax errors or with more
 * nesting than {@code maxDepth}. Runs before any recursive mapping.
 */
final class TreeScan {

    private static final Set<String> TERMINATORS = Set.of("\n", "\u0000");

    /**
     * A token's byte range. Explicit semicolons are flagged: they end line comments.
     */
    record Tok(int start, int end, boolean semicolon) {
    }

    private final List<Tok> tokens = new ArrayList<>();
    private final List<CommentGroup.Comment> comments = new ArrayList<>();

    private TreeScan() {
    }

    static TreeScan of(TSNode root, byte[] source, int maxDepth) {
        TreeScan scan = new TreeScan();
        boolean checkErrors = root.hasError();
        Deque<TSNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);
        while (!nodes.isEmpty()) {
            TSNode node = nodes.pop();
            int depth = depths.pop();
            if (depth > maxDepth) {
                throw new ParseError(start(node), "exceeded max nesting depth");
            }
            String type = node.getType();
            if (checkErrors) {
                checkError(node, type, source);
            }
            int count = ATOMIC.contains(type) ? 0 : node.getChildCount();
            if (count == 0) {
                scan.leaf(node, type, source);
                continue;
            }
            for (int i = count - 1; i >= 0; i--) {
                nodes.push(node.getChild(i));
                depths.push(depth + 1);
            }
        }
        return scan;
    }

    private static void checkError(TSNode node, String type, byte[] source) {
        if ("ERROR".equals(type)) {
            throw new ParseError(start(node), "syntax error: unexpected " + found(source, node));
        }
        if (node.isMissing()) {
            String expected = node.isNamed() ? type : "'" + type + "'";
            throw new ParseError(start(node), "syntax error: missing " + expected);
        }
    }

    private void leaf(TSNode node, String type, byte[] source) {
        int start = start(node);
        int end = end(node);
        if (COMMENT.equals(type)) {
            comments.add(new CommentGroup.Comment(start,
                    new String(source, start, end - start, StandardCharsets.UTF_8)));
            return;
        }
        if (start == end || TERMINATORS.contains(type)) {
            return;
        }
        tokens.add(new Tok(start, end, ";".equals(type)));
    }

    List<Tok> tokens() {
        return tokens;
    }

    List<CommentGroup.Comment> comments() {
        return comments;
    }
}

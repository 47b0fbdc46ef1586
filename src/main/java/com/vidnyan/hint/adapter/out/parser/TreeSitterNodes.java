package com.vidnyan.hint.adapter.out.parser;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Static helpers for navigating tree-sitter nodes.
 */
final class TreeSitterNodes {

    static final String COMMENT = "comment";

    /** Nodes treated as a single token even when the grammar gives them children. */
    static final Set<String> ATOMIC = Set.of(
            "interpreted_string_literal", "raw_string_literal", "rune_literal", COMMENT);

    private static final Set<String> IDENTIFIERS = Set.of(
            "identifier", "field_identifier", "type_identifier", "package_identifier", "label_name");

    private static final Set<String> LITERALS = Set.of(
            "int_literal", "float_literal", "imaginary_literal", "rune_literal",
            "interpreted_string_literal", "raw_string_literal");

    private TreeSitterNodes() {
    }

    static int start(TSNode node) {
        return node.getStartByte();
    }

    static int end(TSNode node) {
        return node.getEndByte();
    }

    static String text(byte[] source, TSNode node) {
        return new String(source, start(node), end(node) - start(node), StandardCharsets.UTF_8);
    }

    static boolean present(TSNode node) {
        return node != null && !node.isNull();
    }

    /**
     * The child stored under a field name, or null.
     */
    static TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return present(child) ? child : null;
    }

    /**
     * All named children stored under a field name, for fields that repeat such as identifier lists.
     */
    static List<TSNode> fields(TSNode node, String name) {
        List<TSNode> out = new ArrayList<>();
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            if (name.equals(node.getFieldNameForChild(i))) {
                TSNode child = node.getChild(i);
                if (child.isNamed()) {
                    out.add(child);
                }
            }
        }
        return out;
    }

    /**
     * Named children without comments.
     */
    static List<TSNode> named(TSNode node) {
        List<TSNode> out = new ArrayList<>();
        int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getNamedChild(i);
            if (!COMMENT.equals(child.getType())) {
                out.add(child);
            }
        }
        return out;
    }

    /**
     * The first named child that is not a comment, or null.
     */
    static TSNode firstNamed(TSNode node) {
        List<TSNode> children = named(node);
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * The first anonymous child spelled {@code text}, or null.
     */
    static TSNode token(TSNode node, String text) {
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (!child.isNamed() && text.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /**
     * The first direct child of the given type, or null.
     */
    static TSNode child(TSNode node, String type) {
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    static boolean same(TSNode a, TSNode b) {
        return a != null && b != null
                && start(a) == start(b) && end(a) == end(b) && a.getType().equals(b.getType());
    }

    /**
     * Describes the first token of a node the way Go error messages do: {@code IDENT x}, {@code INT 1}
     * or the quoted token text.
     */
    static String found(byte[] source, TSNode node) {
        TSNode leaf = node;
        while (leaf.getChildCount() > 0 && !ATOMIC.contains(leaf.getType())) {
            leaf = leaf.getChild(0);
        }
        String text = text(source, leaf);
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline);
        }
        if (text.isEmpty()) {
            return "EOF";
        }
        String type = leaf.getType();
        if (IDENTIFIERS.contains(type)) {
            return "IDENT " + text;
        }
        if (LITERALS.contains(type)) {
            return type.substring(0, type.indexOf('_')).toUpperCase() + " " + text;
        }
        return "'" + text + "'";
    }
}

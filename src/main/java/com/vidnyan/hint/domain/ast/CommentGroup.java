package com.vidnyan.hint.domain.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A sequence of comments with no other tokens and no empty lines between them.
 */
public record CommentGroup(List<Comment> comments) implements Node {

    /**
     * A single {@code //} or {@code /* *\/} comment, text including the comment markers.
     */
    public record Comment(int pos, String text) implements Node {}

    public CommentGroup {
        comments = List.copyOf(comments);
    }

    @Override
    public int pos() {
        return comments.get(0).pos();
    }

    @Override
    public List<Node> children() {
        return Node.childrenOf(comments);
    }

    /**
     * Text of the comment group with markers removed.
     * One space after {@code //} is dropped, trailing whitespace is stripped from each line,
     * leading blank lines are removed, runs of blank lines collapse to one, and the result
     * ends in a single newline unless it is empty.
     */
    public String text() {
        List<String> lines = new ArrayList<>();
        for (Comment c : comments) {
            String t = c.text();
            if (t.startsWith("//")) {
                t = t.substring(2);
                if (!t.isEmpty() && t.charAt(0) == ' ') {
                    t = t.substring(1);
                }
            } else if (t.startsWith("/*")) {
                t = t.substring(2, t.length() - 2);
            }
            for (String line : t.split("\n", -1)) {
                lines.add(stripTrailingWhitespace(line));
            }
        }

        List<String> kept = new ArrayList<>();
        for (String line : lines) {
            if (!line.isEmpty() || (!kept.isEmpty() && !kept.get(kept.size() - 1).isEmpty())) {
                kept.add(line);
            }
        }
        if (!kept.isEmpty() && !kept.get(kept.size() - 1).isEmpty()) {
            kept.add("");
        }
        return String.join("\n", kept);
    }

    private static String stripTrailingWhitespace(String s) {
        int i = s.length();
        while (i > 0) {
            char ch = s.charAt(i - 1);
            if (ch != ' ' && ch != '\t' && ch != '\n' && ch != '\r') {
                break;
            }
            i--;
        }
        return s.substring(0, i);
    }
}

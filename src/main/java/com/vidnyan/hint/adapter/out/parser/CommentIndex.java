package com.vidnyan.hint.adapter.out.parser;

import com.vidnyan.hint.domain.ast.CommentGroup;
import com.vidnyan.hint.domain.lint.LineIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the comments of a file and decides which group documents a declaration and which one
 * trails it.
 *
 * <p>Comments on adjacent lines form a group. Between two tokens, a group that starts on the line
 * of the previous token is that token's line comment when the next token is on another line, is
 * an explicit semicolon, or is the end of file. The last group between two tokens is the lead
 * comment of the next token when it ends on the line right before it.
 */
final class CommentIndex {

    private final LineIndex lines;
    private final List<CommentGroup> groups = new ArrayList<>();
    private final Map<Integer, CommentGroup> leadByTokenStart = new HashMap<>();
    private final Map<Integer, CommentGroup> lineByTokenEnd = new HashMap<>();
    private final Map<Integer, Integer> semicolonAfter = new HashMap<>();
    private final int[] tokenStarts;
    private final int[] tokenEnds;

    private record Group(CommentGroup group, int endLine, int next) {
    }

    CommentIndex(TreeScan scan, LineIndex lines, int eof) {
        this.lines = lines;
        List<TreeScan.Tok> tokens = scan.tokens();
        List<CommentGroup.Comment> comments = scan.comments();
        this.tokenStarts = tokens.stream().mapToInt(TreeScan.Tok::start).toArray();
        this.tokenEnds = tokens.stream().mapToInt(TreeScan.Tok::end).toArray();

        int c = 0;
        int prevEnd = -1;
        int prevLine = 0;
        for (int t = 0; t <= tokens.size(); t++) {
            boolean atEof = t == tokens.size();
            int nextStart = atEof ? eof : tokens.get(t).start();
            int runEnd = c;
            while (runEnd < comments.size() && comments.get(runEnd).pos() < nextStart) {
                runEnd++;
            }
            if (runEnd > c) {
                boolean endsLine = atEof || tokens.get(t).semicolon();
                attach(comments.subList(c, runEnd), prevLine, prevEnd, nextStart, endsLine);
                c = runEnd;
            }
            if (!atEof) {
                TreeScan.Tok tok = tokens.get(t);
                if (tok.semicolon() && prevEnd >= 0) {
                    semicolonAfter.put(prevEnd, tok.end());
                }
                prevEnd = tok.end();
                prevLine = lines.line(tok.end() - 1);
            }
        }
    }

    private void attach(List<CommentGroup.Comment> run, int prevLine, int prevEnd, int nextStart,
                        boolean nextEndsLine) {
        int nextLine = lines.line(nextStart);
        CommentGroup comment = null;
        int k = 0;
        if (prevEnd >= 0 && lines.line(run.get(0).pos()) == prevLine) {
            Group g = group(run, 0, 0);
            comment = g.group();
            k = g.next();
            int following = k < run.size() ? lines.line(run.get(k).pos()) : nextLine;
            if (following != g.endLine() || (k == run.size() && nextEndsLine)) {
                lineByTokenEnd.put(prevEnd, comment);
            }
        }
        int endLine = -1;
        while (k < run.size()) {
            Group g = group(run, k, 1);
            comment = g.group();
            endLine = g.endLine();
            k = g.next();
        }
        if (comment != null && endLine + 1 == nextLine) {
            leadByTokenStart.put(nextStart, comment);
        }
    }

    private Group group(List<CommentGroup.Comment> run, int from, int maxGap) {
        List<CommentGroup.Comment> list = new ArrayList<>();
        int k = from;
        int endLine = lines.line(run.get(k).pos());
        while (k < run.size() && lines.line(run.get(k).pos()) <= endLine + maxGap) {
            CommentGroup.Comment comment = run.get(k);
            endLine = lines.line(comment.pos()) + newlines(comment.text());
            list.add(comment);
            k++;
        }
        CommentGroup group = new CommentGroup(list);
        groups.add(group);
        return new Group(group, endLine, k);
    }

    private static int newlines(String text) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                n++;
            }
        }
        return n;
    }

    /**
     * The doc comment of the syntax that starts at {@code start}, or null.
     */
    CommentGroup docAt(int start) {
        int i = Arrays.binarySearch(tokenStarts, start);
        if (i < 0) {
            i = -i - 1;
        }
        return i < tokenStarts.length ? leadByTokenStart.get(tokenStarts[i]) : null;
    }

    /**
     * The line comment of the syntax that ends at {@code end}, or null. When the syntax is closed
     * by an explicit semicolon, only a comment after the semicolon counts.
     */
    CommentGroup lineCommentAfter(int end) {
        int i = Arrays.binarySearch(tokenEnds, end);
        if (i < 0) {
            i = -i - 2;
        }
        if (i < 0) {
            return null;
        }
        int last = tokenEnds[i];
        Integer semicolon = semicolonAfter.get(last);
        return lineByTokenEnd.get(semicolon != null ? semicolon : last);
    }

    List<CommentGroup> groups() {
        return groups;
    }
}

package com.vidnyan.hint.domain.lint;

import com.vidnyan.hint.domain.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the problems of one file in discovery order.
 * Every rule reports through here; problems below the configured minimum confidence are dropped
 * before they are built.
 */
public final class ProblemCollector {

    private final FileContext file;
    private final double minConfidence;
    private final List<Problem> problems = new ArrayList<>();

    public ProblemCollector(FileContext file) {
        this.file = file;
        this.minConfidence = file.getConfig().getMinConfidence();
    }

    public void report(Node node, double confidence, Category category, String format, Object... args) {
        report(node, confidence, null, category, format, args);
    }

    public void report(Node node, double confidence, String link, Category category, String format,
                       Object... args) {
        if (confidence < minConfidence) {
            return;
        }
        int offset = node.pos();
        LineIndex lines = file.getLines();
        String text = args.length == 0 ? format : String.format(format, args);
        problems.add(new Problem(
                file.getFileName(),
                lines.locate(offset),
                text,
                link == null || link.isEmpty() ? null : link,
                confidence,
                lines.lineText(offset),
                category));
    }

    /**
     * Problems reported so far, in the order they were reported.
     */
    public List<Problem> problems() {
        return List.copyOf(problems);
    }

    public int size() {
        return problems.size();
    }
}

package com.vidnyan.hint.domain.lint;

/**
 * A problem found in a source file.
 * Immutable value object; only {@link ProblemCollector} creates them.
 */
public record Problem(
    String file,
    Location position,
    String text,
    String link,
    double confidence,
    String lineText,
    Category category
) {

    public boolean hasLink() {
        return link != null && !link.isEmpty();
    }

    /**
     * The message text, followed by a blank line and the reference link when there is one.
     */
    public String render() {
        return hasLink() ? text + "\n\n" + link : text;
    }

    @Override
    public String toString() {
        return render();
    }
}

package com.vidnyan.hint.domain.lint;

/**
 * Source code location. Offset is in bytes; line and column are 1-based, column counted in bytes.
 */
public record Location(
    String filePath,
    int offset,
    int line,
    int column
) {

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}

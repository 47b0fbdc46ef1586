package com.vidnyan.hint.domain.lint;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps byte offsets of one source file to lines and columns.
 */
public final class LineIndex {

    private final String fileName;
    private final byte[] source;
    private final int[] lineStarts;

    public LineIndex(String fileName, byte[] source) {
        this.fileName = fileName;
        this.source = source;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length; i++) {
            if (source[i] == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public Location locate(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        if (idx < 0) {
            idx = -idx - 2;
        }
        return new Location(fileName, offset, idx + 1, offset - lineStarts[idx] + 1);
    }

    public int line(int offset) {
        return locate(offset).line();
    }

    /**
     * The complete line containing the offset, including its terminating newline.
     */
    public String lineText(int offset) {
        if (source.length == 0) {
            return "";
        }
        int at = Math.min(Math.max(offset, 0), source.length - 1);
        int lo = at;
        int hi = at + 1;
        while (lo > 0 && source[lo - 1] != '\n') {
            lo--;
        }
        while (hi < source.length && source[hi - 1] != '\n') {
            hi++;
        }
        return new String(source, lo, hi - lo, StandardCharsets.UTF_8);
    }
}

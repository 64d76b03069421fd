package com.raditha.twx.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts source offsets to 1-based lines and 0-based columns. Recognises
 * LF, CRLF, CR and the Unicode line and paragraph separators.
 */
public final class LineMap {

    private final int[] lineStarts;

    public LineMap(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        int n = text.length();
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < n && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n' || c == '\u2028' || c == '\u2029') {
                starts.add(i + 1);
            }
        }
        lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public int line(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1];
    }

    public int lineCount() {
        return lineStarts.length;
    }
}

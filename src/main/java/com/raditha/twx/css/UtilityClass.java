package com.raditha.twx.css;

import java.util.ArrayList;
import java.util.List;

/**
 * A class name split into its parts: {@code md:hover:!-mt-4} has variants
 * {@code [md, hover]}, is important and negative, and has base {@code mt-4}.
 */
record UtilityClass(String raw, List<String> variants, boolean important, boolean negative, String base) {

    /**
     * Split on {@code :} outside of brackets. Returns {@code null} for
     * malformed names (unbalanced brackets, empty segments).
     */
    static UtilityClass parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        List<String> segments = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth < 0) {
                    return null;
                }
            } else if (c == ':' && depth == 0) {
                segments.add(raw.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            return null;
        }
        segments.add(raw.substring(start));
        for (String segment : segments) {
            if (segment.isEmpty()) {
                return null;
            }
        }

        String base = segments.remove(segments.size() - 1);
        boolean important = false;
        if (base.startsWith("!")) {
            important = true;
            base = base.substring(1);
        }
        boolean negative = false;
        if (base.startsWith("-") && base.length() > 1) {
            negative = true;
            base = base.substring(1);
        }
        if (base.isEmpty()) {
            return null;
        }
        return new UtilityClass(raw, List.copyOf(segments), important, negative, base);
    }
}

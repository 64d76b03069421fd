package com.raditha.twx.manifest;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Final shape of the CSS file: a banner comment followed by the bundle,
 * optionally minified.
 */
public final class CssOutput {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private static final String TOOL = "twx";

    private static final String PUNCTUATION = "{};:,>";

    private CssOutput() {
    }

    /**
     * @param bundle    CSS from the compiler; blank when nothing was found
     * @param minify    collapse whitespace and drop comments (the banner stays)
     * @param timestamp generation time shown in the banner
     */
    public static String render(String bundle, boolean minify, Instant timestamp) {
        boolean empty = bundle == null || bundle.isBlank();
        String header = header(empty, minify, timestamp);
        if (empty) {
            return header + "\n";
        }
        if (minify) {
            return header + "\n" + minify(bundle);
        }
        return header + "\n" + bundle;
    }

    static String header(boolean empty, boolean minified, Instant timestamp) {
        String time = TIMESTAMP_FORMAT.format(timestamp);
        if (minified) {
            return empty
                    ? "/* " + TOOL + ": No classes found */"
                    : "/* Generated by " + TOOL + " v" + Manifest.EXTRACTOR_VERSION + " at " + time + " */";
        }
        StringBuilder header = new StringBuilder();
        header.append("/*\n");
        header.append(" * Generated by ").append(TOOL).append(" v").append(Manifest.EXTRACTOR_VERSION).append('\n');
        header.append(" * Generation time: ").append(time).append('\n');
        header.append(" *\n");
        if (empty) {
            header.append(" * No utility classes found\n");
        } else {
            header.append(" * This file contains the extracted utility classes.\n");
            header.append(" * Do not edit manually; regenerate it instead.\n");
        }
        header.append(" */\n");
        return header.toString();
    }

    /**
     * Strip comments and collapse whitespace. A comment at the very start is
     * kept; quoted strings and escaped characters are copied untouched.
     */
    public static String minify(String css) {
        StringBuilder out = new StringBuilder(css.length());
        int n = css.length();
        int i = 0;
        while (i < n && Character.isWhitespace(css.charAt(i))) {
            i++;
        }
        if (css.startsWith("/*", i)) {
            int end = css.indexOf("*/", i + 2);
            if (end >= 0) {
                out.append(css, i, end + 2).append('\n');
                i = end + 2;
            }
        }

        boolean pendingSpace = false;
        char quote = 0;
        while (i < n) {
            char c = css.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == '\\' && i + 1 < n) {
                    out.append(css.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }
            if (c == '/' && i + 1 < n && css.charAt(i + 1) == '*') {
                int end = css.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
                pendingSpace = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                i++;
                continue;
            }
            if (PUNCTUATION.indexOf(c) >= 0) {
                if (c == '}' && out.length() > 0 && out.charAt(out.length() - 1) == ';') {
                    out.setLength(out.length() - 1);
                }
                out.append(c);
                pendingSpace = false;
                i++;
                continue;
            }
            if (pendingSpace && needsSpace(out)) {
                out.append(' ');
            }
            pendingSpace = false;
            if (c == '"' || c == '\'') {
                quote = c;
            }
            out.append(c);
            if (c == '\\' && i + 1 < n) {
                out.append(css.charAt(++i));
            }
            i++;
        }
        return out.toString();
    }

    private static boolean needsSpace(StringBuilder out) {
        if (out.length() == 0) {
            return false;
        }
        char last = out.charAt(out.length() - 1);
        return !Character.isWhitespace(last) && PUNCTUATION.indexOf(last) < 0;
    }
}

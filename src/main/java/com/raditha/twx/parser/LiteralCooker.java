package com.raditha.twx.parser;

import java.util.Arrays;

/**
 * Cooks the raw text of a string or template segment into its runtime value,
 * remembering where in the source each cooked character came from.
 */
final class LiteralCooker {

    /**
     * @param value   cooked text
     * @param offsets source offset of each cooked character, {@code null} when
     *                the raw text has no escapes
     */
    record Cooked(String value, int[] offsets) {
    }

    private final String src;
    private final int end;
    private int pos;
    private int[] offsets = new int[16];
    private int size;

    private LiteralCooker(String src, int from, int to) {
        this.src = src;
        this.pos = from;
        this.end = to;
    }

    static Cooked cook(String src, int from, int to) {
        int slash = src.indexOf('\\', from);
        if (slash < 0 || slash >= to) {
            return new Cooked(src.substring(from, to), null);
        }
        return new LiteralCooker(src, from, to).run();
    }

    private Cooked run() {
        StringBuilder value = new StringBuilder(end - pos);
        while (pos < end) {
            char c = src.charAt(pos);
            if (c == '\\') {
                readEscape(value);
            } else {
                value.append(c);
                add(pos);
                pos++;
            }
        }
        return new Cooked(value.toString(), Arrays.copyOf(offsets, size));
    }

    /**
     * Every character an escape produces maps back to its backslash.
     */
    private void readEscape(StringBuilder value) {
        int escapeStart = pos;
        pos++;
        if (pos >= end) {
            return;
        }
        char c = src.charAt(pos++);
        String cooked = switch (c) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            case 'b' -> "\b";
            case 'f' -> "\f";
            case 'v' -> "\u000B";
            case '0' -> pos < end && isDigit(src.charAt(pos)) ? "0" : "\0";
            case 'x' -> readHex(2);
            case 'u' -> readUnicodeEscape();
            case '\r' -> {
                if (pos < end && src.charAt(pos) == '\n') {
                    pos++;
                }
                yield "";
            }
            case '\n', '\u2028', '\u2029' -> "";
            default -> String.valueOf(c);
        };
        for (int i = 0; i < cooked.length(); i++) {
            value.append(cooked.charAt(i));
            add(escapeStart);
        }
    }

    private String readHex(int digits) {
        if (pos + digits <= end) {
            String hex = src.substring(pos, pos + digits);
            if (isHex(hex)) {
                pos += digits;
                return String.valueOf((char) Integer.parseInt(hex, 16));
            }
        }
        return digits == 2 ? "x" : "u";
    }

    private String readUnicodeEscape() {
        if (pos < end && src.charAt(pos) == '{') {
            int close = src.indexOf('}', pos);
            if (close > pos + 1 && close < end && isHex(src.substring(pos + 1, close))) {
                int codePoint = Integer.parseInt(src.substring(pos + 1, close), 16);
                if (Character.isValidCodePoint(codePoint)) {
                    pos = close + 1;
                    return new String(Character.toChars(codePoint));
                }
            }
            return "u";
        }
        return readHex(4);
    }

    private void add(int offset) {
        if (size == offsets.length) {
            offsets = Arrays.copyOf(offsets, size * 2);
        }
        offsets[size++] = offset;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHex(String s) {
        if (s.isEmpty() || s.length() > 6) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}

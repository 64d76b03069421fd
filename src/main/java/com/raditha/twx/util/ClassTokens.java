package com.raditha.twx.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Whitespace handling shared by the classifier, the rewriter and the visitor.
 * A class string is a whitespace separated list of tokens; whitespace is
 * anything Unicode treats as a space, not just ASCII.
 */
public final class ClassTokens {

    private static final int MAX_TOKEN_LENGTH = 100;

    private ClassTokens() {
    }

    public static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    public static boolean containsWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (isWhitespace(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    public static boolean isBlank(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!isWhitespace(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static List<String> split(String value) {
        List<String> tokens = new ArrayList<>();
        for (Span span : spans(value)) {
            tokens.add(value.substring(span.start(), span.end()));
        }
        return tokens;
    }

    /**
     * Offsets of every token inside {@code value}.
     */
    public static List<Span> spans(String value) {
        List<Span> spans = new ArrayList<>();
        int i = 0;
        int n = value.length();
        while (i < n) {
            while (i < n && isWhitespace(value.charAt(i))) {
                i++;
            }
            int start = i;
            while (i < n && !isWhitespace(value.charAt(i))) {
                i++;
            }
            if (i > start) {
                spans.add(new Span(start, i));
            }
        }
        return spans;
    }

    public static int count(String value) {
        return spans(value).size();
    }

    /**
     * Join tokens with a single space.
     */
    public static String normalize(String value) {
        return String.join(" ", split(value));
    }

    /**
     * Tokens that cannot possibly be a CSS class name are never recorded, even
     * when they appear in a class attribute.
     */
    public static boolean isRecordable(String token) {
        if (token.isEmpty() || token.length() > MAX_TOKEN_LENGTH) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '<' || c == '>' || c == '{' || c == '}' || c == ';' || c == '"' || c == '\'' || c == '`') {
                return false;
            }
        }
        return true;
    }

    public record Span(int start, int end) {
    }
}

package com.raditha.twx.classify;

import com.raditha.twx.util.ClassTokens;

import java.util.List;

/**
 * Decides whether a string literal holds utility class names. Inside a
 * class-bearing context the bar is low; elsewhere the value must also look
 * like a well-known utility family so ordinary UI text is left alone.
 */
public class ClassLikenessClassifier {

    private static final List<String> NON_CLASS_PREFIXES = List.of("http://", "https://", "/", "./", "../");

    private static final List<String> UTILITY_PREFIXES = List.of(
            "bg-", "text-",
            "p-", "px-", "py-", "pt-", "pr-", "pb-", "pl-", "ps-", "pe-",
            "m-", "mx-", "my-", "mt-", "mr-", "mb-", "ml-", "ms-", "me-",
            "flex", "grid", "hover:", "focus:", "active:", "sm:", "md:", "lg:", "xl:", "2xl:", "dark:",
            "border", "rounded", "w-", "h-", "min-", "max-", "gap-", "space-", "items-", "justify-",
            "font-", "shadow", "ring", "opacity-", "z-", "inset-", "top-", "left-", "right-", "bottom-",
            "col-", "row-", "leading-", "tracking-", "transition", "duration-", "overflow-");

    /**
     * @param value          cooked string value
     * @param inClassContext whether the string sits in a class-bearing context
     */
    public boolean isClassLike(String value, boolean inClassContext) {
        if (value == null || value.length() < 2) {
            return false;
        }
        for (String prefix : NON_CLASS_PREFIXES) {
            if (value.startsWith(prefix)) {
                return false;
            }
        }
        if (value.indexOf('\\') >= 0) {
            return false;
        }
        if (looksLikeProse(value) || !hasOnlyClassCharacters(value)) {
            return false;
        }
        boolean marker = hasMarker(value);
        if (inClassContext) {
            return marker || ClassTokens.containsWhitespace(value);
        }
        List<String> tokens = ClassTokens.split(value);
        if (marker && tokens.stream().anyMatch(ClassLikenessClassifier::hasUtilityPrefix)) {
            return true;
        }
        return tokens.size() > 1 && tokens.stream().anyMatch(t -> t.indexOf('-') >= 0 || t.length() > 3);
    }

    public boolean isClassLike(String value, ContextStack stack) {
        return isClassLike(value, stack.inClassContext());
    }

    static boolean hasUtilityPrefix(String token) {
        String bare = token.startsWith("!") || token.startsWith("-") ? token.substring(1) : token;
        for (String prefix : UTILITY_PREFIXES) {
            if (bare.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean looksLikeProse(String value) {
        if (value.indexOf('!') >= 0 || value.indexOf('?') >= 0 || value.indexOf(',') >= 0) {
            return true;
        }
        return value.indexOf('.') >= 0 && !hasNumericFraction(value);
    }

    private static boolean hasNumericFraction(String value) {
        for (int i = 1; i < value.length(); i++) {
            if (value.charAt(i) == '.' && Character.isDigit(value.charAt(i - 1))) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasMarker(String value) {
        return value.indexOf('-') >= 0 || value.indexOf(':') >= 0 || value.indexOf('[') >= 0
                || value.indexOf(']') >= 0;
    }

    private static boolean hasOnlyClassCharacters(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean asciiAlnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!asciiAlnum && "-_:[]()/#%.".indexOf(c) < 0 && !ClassTokens.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }
}

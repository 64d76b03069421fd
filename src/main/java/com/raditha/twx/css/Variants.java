package com.raditha.twx.css;

import java.util.List;
import java.util.Map;

/**
 * Selector and media-query variants.
 */
final class Variants {

    /**
     * Media variants in output order; a rule's bucket sorts by the first of
     * its media variants in this list.
     */
    static final List<String> MEDIA_ORDER = List.of(
            "sm", "md", "lg", "xl", "2xl", "dark", "motion-safe", "motion-reduce", "print");

    private static final Map<String, String> MEDIA = Map.of(
            "sm", "(min-width: 640px)",
            "md", "(min-width: 768px)",
            "lg", "(min-width: 1024px)",
            "xl", "(min-width: 1280px)",
            "2xl", "(min-width: 1536px)",
            "dark", "(prefers-color-scheme: dark)",
            "motion-safe", "(prefers-reduced-motion: no-preference)",
            "motion-reduce", "(prefers-reduced-motion: reduce)",
            "print", "print");

    private static final Map<String, String> PSEUDO = Map.ofEntries(
            Map.entry("hover", ":hover"),
            Map.entry("focus", ":focus"),
            Map.entry("active", ":active"),
            Map.entry("visited", ":visited"),
            Map.entry("disabled", ":disabled"),
            Map.entry("enabled", ":enabled"),
            Map.entry("checked", ":checked"),
            Map.entry("required", ":required"),
            Map.entry("invalid", ":invalid"),
            Map.entry("focus-within", ":focus-within"),
            Map.entry("focus-visible", ":focus-visible"),
            Map.entry("first", ":first-child"),
            Map.entry("last", ":last-child"),
            Map.entry("only", ":only-child"),
            Map.entry("odd", ":nth-child(odd)"),
            Map.entry("even", ":nth-child(even)"),
            Map.entry("empty", ":empty"),
            Map.entry("placeholder", "::placeholder"),
            Map.entry("before", "::before"),
            Map.entry("after", "::after"),
            Map.entry("selection", "::selection"),
            Map.entry("marker", "::marker"),
            Map.entry("file", "::file-selector-button"));

    private static final Map<String, String> GROUP = Map.of(
            "group-hover", ".group:hover",
            "group-focus", ".group:focus",
            "group-active", ".group:active",
            "peer-hover", ".peer:hover ~",
            "peer-focus", ".peer:focus ~",
            "peer-checked", ".peer:checked ~");

    private Variants() {
    }

    static boolean isKnown(String variant) {
        return MEDIA.containsKey(variant) || PSEUDO.containsKey(variant) || GROUP.containsKey(variant);
    }

    static boolean isMedia(String variant) {
        return MEDIA.containsKey(variant);
    }

    static String mediaCondition(String variant) {
        return MEDIA.get(variant);
    }

    static String pseudo(String variant) {
        return PSEUDO.get(variant);
    }

    static String groupPrefix(String variant) {
        return GROUP.get(variant);
    }

    static boolean isPseudoElement(String variant) {
        return "before".equals(variant) || "after".equals(variant);
    }

    static int mediaRank(String variant) {
        int rank = MEDIA_ORDER.indexOf(variant);
        return rank < 0 ? MEDIA_ORDER.size() : rank;
    }
}

package com.raditha.twx.model;

import java.util.Locale;

/**
 * Source dialect of a unit: plain script or typed (TypeScript), each with or
 * without JSX.
 *
 * @param language script or typed
 * @param jsx      whether {@code <Element>} syntax is recognised in expression position
 */
public record Dialect(Language language, boolean jsx) {

    public enum Language {
        SCRIPT,
        TYPED
    }

    public static final Dialect SCRIPT_JSX = new Dialect(Language.SCRIPT, true);
    public static final Dialect TYPED = new Dialect(Language.TYPED, false);
    public static final Dialect TYPED_JSX = new Dialect(Language.TYPED, true);

    public Dialect {
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
    }

    public boolean typed() {
        return language == Language.TYPED;
    }

    /**
     * Infer the dialect from a file name. {@code .ts} files are typed without
     * JSX because the angle-bracket cast syntax conflicts with elements;
     * {@code .tsx} is typed with JSX; everything else (including stdin) is
     * script with JSX enabled.
     */
    public static Dialect forFileName(String fileName) {
        if (fileName == null) {
            return SCRIPT_JSX;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".d.ts") || lower.endsWith(".ts") || lower.endsWith(".mts") || lower.endsWith(".cts")) {
            return TYPED;
        }
        if (lower.endsWith(".tsx")) {
            return TYPED_JSX;
        }
        return SCRIPT_JSX;
    }
}

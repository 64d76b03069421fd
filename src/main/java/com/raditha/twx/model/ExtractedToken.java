package com.raditha.twx.model;

/**
 * A single class token found in a class-bearing string.
 *
 * @param value  the class name as written (before any rewrite)
 * @param file   identity of the source unit
 * @param line   1-based line of the token itself
 * @param column 0-based column of the token itself
 */
public record ExtractedToken(String value, String file, int line, int column) {

    public ExtractedToken {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("value cannot be empty");
        }
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1");
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must be >= 0");
        }
    }

    /**
     * Location in {@code file:line:column} form.
     */
    public String location() {
        return file + ":" + line + ":" + column;
    }
}

package com.raditha.twx.model;

import java.nio.file.Path;

/**
 * One source text to analyse. Immutable.
 *
 * @param identity display path or {@code <stdin>}; used in positions and the manifest
 * @param content  full UTF-8 decoded text
 * @param dialect  parsing dialect
 */
public record SourceUnit(String identity, String content, Dialect dialect) {

    public static final String STDIN = "<stdin>";

    public SourceUnit {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (dialect == null) {
            dialect = Dialect.forFileName(identity);
        }
    }

    public static SourceUnit of(Path path, String content) {
        String identity = path.toString();
        return new SourceUnit(identity, content, Dialect.forFileName(identity));
    }

    public static SourceUnit of(String identity, String content) {
        return new SourceUnit(identity, content, Dialect.forFileName(identity));
    }

    public static SourceUnit stdin(String content) {
        return new SourceUnit(STDIN, content, Dialect.SCRIPT_JSX);
    }
}

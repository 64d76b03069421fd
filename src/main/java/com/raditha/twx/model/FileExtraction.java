package com.raditha.twx.model;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Per-file result produced by a worker task.
 *
 * @param identity         source unit identity
 * @param tokens           every class token found, in traversal order
 * @param transformedCode  rewritten source, or {@code null} for extraction-only runs
 * @param transformedCount literals changed by the rewriter
 * @param elapsedNanos     time spent parsing and traversing
 */
public record FileExtraction(
        String identity,
        List<ExtractedToken> tokens,
        String transformedCode,
        int transformedCount,
        long elapsedNanos) {

    public FileExtraction {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public boolean hasClasses() {
        return !tokens.isEmpty();
    }

    public TransformResult toTransformResult(String originalCode) {
        List<String> distinct = List.copyOf(new LinkedHashSet<>(tokens.stream().map(ExtractedToken::value).toList()));
        String code = transformedCode != null ? transformedCode : originalCode;
        return new TransformResult(code, transformedCount, distinct, tokens.size());
    }
}

package com.raditha.twx.model;

import java.util.List;

/**
 * Outcome of rewriting one source unit.
 *
 * @param code             serialized source after rewriting
 * @param transformedCount number of literals whose value actually changed
 * @param classes          distinct class names seen, in first-seen order
 * @param originalCount    total class tokens seen, duplicates included
 */
public record TransformResult(String code, int transformedCount, List<String> classes, int originalCount) {

    public TransformResult {
        classes = classes == null ? List.of() : List.copyOf(classes);
    }

    public boolean changed() {
        return transformedCount > 0;
    }
}

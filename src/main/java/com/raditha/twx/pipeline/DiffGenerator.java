package com.raditha.twx.pipeline;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.List;

/**
 * Generates unified diffs for transform previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    public static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between original and rewritten source.
     *
     * @param fileName display name used in the {@code a/} and {@code b/} headers
     * @return unified diff, or an empty string when the texts are equal
     */
    public String generateUnifiedDiff(String fileName, String original, String revised) {
        return generateUnifiedDiff(fileName, original, revised, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, String original, String revised, int contextLines) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}

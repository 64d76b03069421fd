package com.raditha.twx.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Machine-readable summary of an extraction run, written next to the CSS.
 *
 * @param metadata   run description
 * @param classes    every class found, by name
 * @param mappings   class to alias; absent when obfuscation is off
 * @param statistics sizes, counts and timings; absent for source-only runs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Manifest(
        Metadata metadata,
        Map<String, ClassEntry> classes,
        Map<String, String> mappings,
        Statistics statistics) {

    public static final String FORMAT_VERSION = "1.0.0";
    public static final String EXTRACTOR_VERSION = "1.0.0";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Metadata(
            String version,
            Instant generatedAt,
            int filesProcessed,
            int classesExtracted,
            boolean obfuscationEnabled,
            String buildMode,
            String extractorVersion) {
    }

    /**
     * @param count     occurrences after deduplication
     * @param files     files containing the class, first-seen order
     * @param locations every occurrence as {@code file:line:column}
     */
    public record ClassEntry(int count, List<String> files, List<String> locations) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Statistics(
            long cssSizeBytes,
            Long minifiedSizeBytes,
            int filesMatched,
            int filesWithClasses,
            int filesSkipped,
            long processingTimeMs,
            List<TopClass> topClasses) {
    }

    public record TopClass(String name, int count, int fileCount) {
    }
}

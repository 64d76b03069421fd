package com.raditha.twx.model;

import com.raditha.twx.extraction.ClassRegistry;
import com.raditha.twx.manifest.Manifest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of an extraction run.
 *
 * @param registry       merged registry of every class found
 * @param css            CSS as written (banner included, minified if requested)
 * @param manifest       manifest as written
 * @param mappings       class to alias; empty when obfuscation is off
 * @param filesMatched   files returned by discovery
 * @param filesProcessed files parsed and traversed
 * @param skippedFiles   files left out, with the reason
 * @param elapsed        wall time of the run
 * @param written        false for dry runs
 */
public record ExtractionResult(
        ClassRegistry registry,
        String css,
        Manifest manifest,
        Map<String, String> mappings,
        int filesMatched,
        int filesProcessed,
        List<String> skippedFiles,
        Duration elapsed,
        boolean written) {

    public ExtractionResult {
        mappings = mappings == null ? Map.of() : Map.copyOf(mappings);
        skippedFiles = skippedFiles == null ? List.of() : List.copyOf(skippedFiles);
    }

    public int filesSkipped() {
        return skippedFiles.size();
    }

    public int uniqueClasses() {
        return registry.uniqueCount();
    }
}

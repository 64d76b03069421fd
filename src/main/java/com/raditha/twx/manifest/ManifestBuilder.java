package com.raditha.twx.manifest;

import com.raditha.twx.extraction.ClassRegistry;
import com.raditha.twx.model.ClassRecord;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the manifest for a finished run.
 * <p>
 * Classes are listed by name so the document does not depend on the order in
 * which workers finished.
 */
public class ManifestBuilder {

    public static final int DEFAULT_TOP_N = 10;

    private final Clock clock;
    private final int topN;

    public ManifestBuilder() {
        this(Clock.systemUTC(), DEFAULT_TOP_N);
    }

    public ManifestBuilder(Clock clock, int topN) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0");
        }
        this.clock = clock;
        this.topN = topN;
    }

    /**
     * Counters of the run that the registry does not know about.
     *
     * @param filesMatched      files returned by discovery
     * @param filesProcessed    files parsed and traversed
     * @param filesSkipped      files rejected by the security gate or skipped on error
     * @param cssSizeBytes      size of the CSS before minification
     * @param minifiedSizeBytes size after minification, {@code null} when not minified
     * @param processingTimeMs  wall time of the run
     */
    public record RunStats(
            int filesMatched,
            int filesProcessed,
            int filesSkipped,
            long cssSizeBytes,
            Long minifiedSizeBytes,
            long processingTimeMs) {
    }

    /**
     * @param mappings  aliases, or {@code null} when obfuscation is off
     * @param stats     run counters, or {@code null} to leave statistics out
     * @param buildMode free-form label, may be null
     */
    public Manifest build(ClassRegistry registry, @Nullable Map<String, String> mappings, @Nullable RunStats stats,
                          @Nullable String buildMode) {
        List<ClassRecord> byName = new ArrayList<>(registry.records());
        byName.sort(Comparator.comparing(ClassRecord::getOriginal));

        Map<String, Manifest.ClassEntry> classes = new LinkedHashMap<>();
        for (ClassRecord record : byName) {
            classes.put(record.getOriginal(), new Manifest.ClassEntry(record.getCount(),
                    List.copyOf(record.getFiles()), List.copyOf(record.getLocations())));
        }

        Map<String, String> sortedMappings = null;
        if (mappings != null) {
            sortedMappings = new LinkedHashMap<>();
            for (ClassRecord record : byName) {
                String alias = mappings.get(record.getOriginal());
                if (alias != null) {
                    sortedMappings.put(record.getOriginal(), alias);
                }
            }
        }

        Manifest.Metadata metadata = new Manifest.Metadata(
                Manifest.FORMAT_VERSION,
                Instant.now(clock),
                stats != null ? stats.filesProcessed() : registry.filesWithClasses().size(),
                registry.uniqueCount(),
                mappings != null,
                buildMode,
                Manifest.EXTRACTOR_VERSION);

        Manifest.Statistics statistics = null;
        if (stats != null) {
            statistics = new Manifest.Statistics(
                    stats.cssSizeBytes(),
                    stats.minifiedSizeBytes(),
                    stats.filesMatched(),
                    registry.filesWithClasses().size(),
                    stats.filesSkipped(),
                    stats.processingTimeMs(),
                    topClasses(byName));
        }
        return new Manifest(metadata, classes, sortedMappings, statistics);
    }

    /**
     * Most used classes, highest count first, ties broken by name.
     */
    List<Manifest.TopClass> topClasses(List<ClassRecord> records) {
        return records.stream()
                .sorted(Comparator.comparingInt(ClassRecord::getCount).reversed()
                        .thenComparing(ClassRecord::getOriginal))
                .limit(topN)
                .map(r -> new Manifest.TopClass(r.getOriginal(), r.getCount(), r.getFiles().size()))
                .toList();
    }
}

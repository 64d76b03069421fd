package com.raditha.twx.pipeline;

import com.raditha.twx.extraction.ClassRegistry;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of a transform run.
 *
 * @param registry       classes seen in the processed files, original names
 * @param changes        files whose content changed, in path order
 * @param filesMatched   files returned by discovery
 * @param filesProcessed files parsed and rewritten
 * @param skippedFiles   files left out, with the reason
 * @param elapsed        wall time of the run
 * @param written        false for dry runs
 */
public record TransformReport(
        ClassRegistry registry,
        List<FileChange> changes,
        int filesMatched,
        int filesProcessed,
        List<String> skippedFiles,
        Duration elapsed,
        boolean written) {

    public TransformReport {
        changes = changes == null ? List.of() : List.copyOf(changes);
        skippedFiles = skippedFiles == null ? List.of() : List.copyOf(skippedFiles);
    }

    /**
     * @param identity         file name relative to the root
     * @param target           where the rewritten file goes
     * @param transformedCount literals changed
     * @param diff             unified diff, only filled in on dry runs
     */
    public record FileChange(String identity, Path target, int transformedCount, String diff) {
    }

    public int literalsChanged() {
        return changes.stream().mapToInt(FileChange::transformedCount).sum();
    }
}

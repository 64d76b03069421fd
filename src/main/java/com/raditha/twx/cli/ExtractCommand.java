package com.raditha.twx.cli;

import com.raditha.twx.config.ExtractorConfig;
import com.raditha.twx.exceptions.ExtractorException;
import com.raditha.twx.manifest.Manifest;
import com.raditha.twx.model.ExtractionResult;
import com.raditha.twx.pipeline.ExtractionPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Scans the configured sources and writes the CSS bundle plus the manifest.
 */
@Command(name = "extract", mixinStandardHelpOptions = true, version = "twx v" + Manifest.EXTRACTOR_VERSION,
        description = "Extract utility classes and write the CSS bundle and manifest")
public class ExtractCommand implements Callable<Integer> {

    @Mixin
    CommonOptions common;

    @Option(names = {"-i", "--input"}, description = "Glob patterns of the files to scan", paramLabel = "<pattern>",
            arity = "1..*")
    List<String> input = new ArrayList<>();

    @Option(names = {"-o", "--output-css"}, description = "Where the CSS bundle goes", paramLabel = "<path>",
            required = true)
    Path outputCss;

    @Option(names = {"-m", "--output-manifest"}, description = "Where the JSON manifest goes", paramLabel = "<path>",
            required = true)
    Path outputManifest;

    @Option(names = "--obfuscate", description = "Replace recognized utilities with short aliases")
    boolean obfuscate;

    @Option(names = "--minify", description = "Minify the CSS output")
    boolean minify;

    @Option(names = "--no-preflight", description = "Leave out the base reset styles")
    boolean noPreflight;

    @Option(names = "--dry-run", description = "Show what would be extracted without writing anything")
    boolean dryRun;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws ExtractorException, IOException, InterruptedException {
        common.applyLogging();
        validateOutputs();
        ExtractorConfig config = common.load(input, obfuscate, minify, noPreflight);

        ExtractionResult result = new ExtractionPipeline(config).extract(outputCss, outputManifest, dryRun);
        printSummary(result);
        return TwxCLI.EXIT_OK;
    }

    private void validateOutputs() {
        if (outputCss.toAbsolutePath().normalize().equals(outputManifest.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Output CSS and manifest paths must be different");
        }
    }

    private void printSummary(ExtractionResult result) {
        PrintWriter out = spec.commandLine().getOut();
        if (dryRun) {
            out.println("Dry run: no files written");
        } else {
            out.println("Extraction successful!");
        }
        out.printf("  Files processed: %d of %d%n", result.filesProcessed(), result.filesMatched());
        out.printf("  Unique classes:  %d%n", result.uniqueClasses());
        out.printf("  Occurrences:     %d%n", result.registry().totalOccurrences());
        if (!result.mappings().isEmpty()) {
            out.printf("  Obfuscated:      %d%n", result.mappings().size());
        }
        if (result.filesSkipped() > 0) {
            out.printf("  Skipped:         %d%n", result.filesSkipped());
            for (String skipped : result.skippedFiles()) {
                out.println("    - " + skipped);
            }
        }
        if (result.written()) {
            out.println("  CSS:      " + outputCss);
            out.println("  Manifest: " + outputManifest);
        }
        out.printf("  Time: %d ms%n", result.elapsed().toMillis());
        out.flush();
    }
}

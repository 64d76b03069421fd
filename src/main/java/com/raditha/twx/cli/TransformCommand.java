package com.raditha.twx.cli;

import com.raditha.twx.config.ExtractorConfig;
import com.raditha.twx.exceptions.ExtractorException;
import com.raditha.twx.manifest.Manifest;
import com.raditha.twx.pipeline.ExtractionPipeline;
import com.raditha.twx.pipeline.TransformReport;
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
 * Rewrites the class strings of the configured sources, in place or into an
 * output directory.
 */
@Command(name = "transform", mixinStandardHelpOptions = true, version = "twx v" + Manifest.EXTRACTOR_VERSION,
        description = "Rewrite class strings in the source files")
public class TransformCommand implements Callable<Integer> {

    @Mixin
    CommonOptions common;

    @Option(names = {"-i", "--input"}, description = "Glob patterns of the files to rewrite", paramLabel = "<pattern>",
            arity = "1..*")
    List<String> input = new ArrayList<>();

    @Option(names = {"-d", "--output-dir"}, description = "Write rewritten files here instead of in place",
            paramLabel = "<dir>")
    Path outputDir;

    @Option(names = "--obfuscate", description = "Replace recognized utilities with short aliases")
    boolean obfuscate;

    @Option(names = "--dry-run", description = "Print unified diffs instead of writing")
    boolean dryRun;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws ExtractorException, IOException, InterruptedException {
        common.applyLogging();
        ExtractorConfig config = common.load(input, obfuscate, null, null);

        TransformReport report = new ExtractionPipeline(config).transform(outputDir, dryRun);

        PrintWriter out = spec.commandLine().getOut();
        if (dryRun) {
            for (TransformReport.FileChange change : report.changes()) {
                out.println(change.diff());
            }
        }
        out.printf("%s %d file(s), %d literal(s) changed, %d skipped%n",
                dryRun ? "Would rewrite" : "Rewrote",
                report.changes().size(), report.literalsChanged(), report.skippedFiles().size());
        out.flush();
        return TwxCLI.EXIT_OK;
    }
}

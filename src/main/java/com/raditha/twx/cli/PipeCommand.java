package com.raditha.twx.cli;

import com.raditha.twx.config.ExtractorConfig;
import com.raditha.twx.config.ExtractorSettings;
import com.raditha.twx.exceptions.ExtractorException;
import com.raditha.twx.manifest.Manifest;
import com.raditha.twx.model.SourceUnit;
import com.raditha.twx.pipeline.ExtractionPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Reads one source from standard input and prints its CSS, or the rewritten
 * source with {@code --transform}.
 */
@Command(name = "pipe", mixinStandardHelpOptions = true, version = "twx v" + Manifest.EXTRACTOR_VERSION,
        description = "Read source from stdin and write CSS (or rewritten source) to stdout")
public class PipeCommand implements Callable<Integer> {

    private final InputStream in;

    @Option(names = {"-c", "--config"}, description = "Configuration file (YAML or JSON)", paramLabel = "<path>")
    Path configFile;

    @Option(names = "--file-name", description = "Name used in positions and to pick the dialect",
            paramLabel = "<name>", defaultValue = SourceUnit.STDIN)
    String fileName;

    @Option(names = "--transform", description = "Print the rewritten source instead of CSS")
    boolean transform;

    @Option(names = "--obfuscate", description = "Replace recognized utilities with short aliases")
    boolean obfuscate;

    @Option(names = "--minify", description = "Minify the CSS output")
    boolean minify;

    @Option(names = "--no-preflight", description = "Leave out the base reset styles")
    boolean noPreflight;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    boolean verbose;

    @Spec
    CommandSpec spec;

    public PipeCommand() {
        this(System.in);
    }

    PipeCommand(InputStream in) {
        this.in = in;
    }

    @Override
    public Integer call() throws ExtractorException, IOException {
        if (verbose) {
            CommonOptions.enableDebugLogging();
        }
        ExtractorConfig config = ExtractorSettings.loadConfig(configFile, new ExtractorSettings.Overrides(
                null, null, null, obfuscate, minify, noPreflight, null, null));
        String code = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        SourceUnit unit = SourceUnit.STDIN.equals(fileName) ? SourceUnit.stdin(code) : SourceUnit.of(fileName, code);

        ExtractionPipeline pipeline = new ExtractionPipeline(config);
        PrintWriter out = spec.commandLine().getOut();
        if (transform) {
            out.print(pipeline.transformSource(unit).code());
        } else {
            out.print(pipeline.cssFor(unit));
        }
        out.flush();
        return TwxCLI.EXIT_OK;
    }
}

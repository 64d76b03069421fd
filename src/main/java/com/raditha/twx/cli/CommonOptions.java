package com.raditha.twx.cli;

import ch.qos.logback.classic.Level;
import com.raditha.twx.config.ExtractorConfig;
import com.raditha.twx.config.ExtractorSettings;
import com.raditha.twx.config.ParseErrorPolicy;
import com.raditha.twx.exceptions.ConfigException;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by the file-set commands.
 */
public class CommonOptions {

    static final String BASE_PACKAGE = "com.raditha.twx";

    @Option(names = {"-c", "--config"}, description = "Configuration file (YAML or JSON)", paramLabel = "<path>")
    Path configFile;

    @Option(names = {"-e", "--exclude"}, description = "Glob patterns to leave out", paramLabel = "<pattern>",
            arity = "1..*")
    List<String> exclude = new ArrayList<>();

    @Option(names = {"-j", "--jobs"}, description = "Worker threads (default: number of processors)",
            paramLabel = "<n>")
    Integer jobs;

    @Option(names = "--root", description = "Directory that patterns are relative to and outputs must stay in",
            paramLabel = "<path>")
    Path root;

    @Option(names = "--on-parse-error", description = "What to do when a file does not parse: fail or skip",
            paramLabel = "<policy>", converter = ParseErrorPolicyConverter.class)
    ParseErrorPolicy onParseError;

    @Option(names = {"-v", "--verbose"}, description = "Log every file processed")
    boolean verbose;

    /**
     * Validate CLI values before anything is loaded.
     *
     * @throws IllegalArgumentException if a value is invalid
     */
    void validate() {
        if (jobs != null && jobs < 1) {
            throw new IllegalArgumentException("Number of jobs must be at least 1, got: " + jobs);
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (root != null && !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Root is not a directory: " + root);
        }
    }

    ExtractorConfig load(List<String> input, Boolean obfuscate, Boolean minify, Boolean noPreflight)
            throws ConfigException {
        validate();
        ExtractorConfig config = ExtractorSettings.loadConfig(configFile, new ExtractorSettings.Overrides(
                input, exclude, jobs, obfuscate, minify, noPreflight, onParseError, root));
        if (config.content().isEmpty()) {
            throw new IllegalArgumentException("At least one input pattern must be provided");
        }
        return config;
    }

    void applyLogging() {
        if (verbose) {
            enableDebugLogging();
        }
    }

    static void enableDebugLogging() {
        if (LoggerFactory.getLogger(BASE_PACKAGE) instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        }
    }

    /**
     * Custom converter for ParseErrorPolicy enum to handle CLI string values.
     */
    public static class ParseErrorPolicyConverter implements ITypeConverter<ParseErrorPolicy> {
        @Override
        public ParseErrorPolicy convert(String value) {
            return ParseErrorPolicy.fromString(value);
        }
    }
}

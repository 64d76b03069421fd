package com.raditha.twx.cli;

import com.raditha.twx.exceptions.ConfigException;
import com.raditha.twx.exceptions.NoFilesFoundException;
import com.raditha.twx.exceptions.OutputException;
import com.raditha.twx.exceptions.ParseException;
import com.raditha.twx.exceptions.PatternException;
import com.raditha.twx.exceptions.SecurityException;
import com.raditha.twx.manifest.Manifest;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the utility-class extractor.
 * <p>
 * Usage:
 * java -jar twx.jar extract -i 'src/**&#47;*.jsx' -o dist/app.css -m dist/manifest.json
 * <p>
 * Configuration priority: CLI arguments > configuration file > defaults
 * <p>
 * Exit codes: 0 success, 1 unexpected error, 2 configuration or usage error,
 * 3 I/O or output error, 4 interrupted, 5 parse error, 6 no files found.
 */
@Command(name = "twx", mixinStandardHelpOptions = true, version = "twx v" + Manifest.EXTRACTOR_VERSION,
        description = "Extracts utility classes from JavaScript/TypeScript/JSX sources",
        subcommands = {ExtractCommand.class, TransformCommand.class, PipeCommand.class})
public class TwxCLI implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_INTERRUPTED = 4;
    static final int EXIT_PARSE = 5;
    static final int EXIT_NO_FILES = 6;

    @Spec
    CommandSpec spec;

    /**
     * Without a subcommand there is nothing to do: print usage.
     */
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_USAGE;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with error handling configured.
     */
    public static CommandLine commandLine() {
        return configure(new CommandLine(new TwxCLI()));
    }

    static CommandLine configure(CommandLine cmd) {
        // Handle execution exceptions with appropriate exit codes
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            int code = exitCodeFor(ex);
            commandLine.getErr().println(messageFor(ex, code));
            if (code == EXIT_ERROR) {
                ex.printStackTrace(commandLine.getErr());
            }
            return code;
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failing = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            failing.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failing.getErr());
            failing.getErr().print(failing.getUsageMessage(colorScheme));
            return EXIT_USAGE;
        });
        return cmd;
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof ParseException) {
            return EXIT_PARSE;
        }
        if (ex instanceof NoFilesFoundException) {
            return EXIT_NO_FILES;
        }
        if (ex instanceof ConfigException || ex instanceof PatternException || ex instanceof IllegalArgumentException) {
            return EXIT_USAGE;
        }
        if (ex instanceof IOException || ex instanceof OutputException || ex instanceof SecurityException) {
            return EXIT_IO;
        }
        if (ex instanceof InterruptedException) {
            return EXIT_INTERRUPTED;
        }
        return EXIT_ERROR;
    }

    private static String messageFor(Exception ex, int code) {
        return switch (code) {
            case EXIT_USAGE -> "Configuration error: " + ex.getMessage();
            case EXIT_IO -> "I/O error: " + ex.getMessage();
            case EXIT_INTERRUPTED -> "Process interrupted: " + ex.getMessage();
            case EXIT_PARSE, EXIT_NO_FILES -> "Error: " + ex.getMessage();
            default -> "Error: " + ex.getMessage();
        };
    }
}

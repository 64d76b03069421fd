package com.raditha.twx.exceptions;

import java.nio.file.Path;

/**
 * Writing an output file failed. The previous content of the target, if any,
 * is left untouched.
 */
public class OutputException extends ExtractorException {

    private final transient Path path;

    public OutputException(Path path, String message, Throwable cause) {
        super("Failed to write " + path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}

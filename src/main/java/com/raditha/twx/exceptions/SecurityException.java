package com.raditha.twx.exceptions;

import java.nio.file.Path;

/**
 * A path violated the security policy.
 * <p>
 * For input files this is recovered by skipping the file. For output paths it
 * aborts the run before any work starts.
 */
public class SecurityException extends ExtractorException {

    private final transient Path path;

    public SecurityException(Path path, String message) {
        super("Security violation: " + message + ": " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}

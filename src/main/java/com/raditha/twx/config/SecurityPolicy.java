package com.raditha.twx.config;

import java.nio.file.Path;

/**
 * Limits applied to every input and output path.
 *
 * @param maxFileSize   largest input file accepted, in bytes
 * @param allowSymlinks whether symbolic links are followed (their targets must stay inside {@code root})
 * @param root          directory that outputs and followed links must resolve inside
 */
public record SecurityPolicy(long maxFileSize, boolean allowSymlinks, Path root) {

    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

    public SecurityPolicy {
        if (maxFileSize < 1) {
            throw new IllegalArgumentException("maxFileSize must be >= 1");
        }
        if (root == null) {
            root = Path.of("").toAbsolutePath();
        }
        root = root.toAbsolutePath().normalize();
    }

    public static SecurityPolicy defaults() {
        return new SecurityPolicy(DEFAULT_MAX_FILE_SIZE, false, null);
    }

    public SecurityPolicy withRoot(Path newRoot) {
        return new SecurityPolicy(maxFileSize, allowSymlinks, newRoot);
    }
}

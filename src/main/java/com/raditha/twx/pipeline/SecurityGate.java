package com.raditha.twx.pipeline;

import com.raditha.twx.config.SecurityPolicy;
import com.raditha.twx.exceptions.SecurityException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Applies the {@link SecurityPolicy} to input files and output paths.
 * <p>
 * A rejected input only removes that file from the run. A rejected output path
 * aborts the run before any file is read.
 */
public class SecurityGate {

    private final SecurityPolicy policy;

    public SecurityGate(SecurityPolicy policy) {
        this.policy = policy;
    }

    public SecurityPolicy getPolicy() {
        return policy;
    }

    /**
     * @throws SecurityException if the file is a forbidden or escaping link,
     *                           not a regular file, or larger than the limit
     * @throws IOException       if the file cannot be inspected
     */
    public void checkInput(Path file) throws SecurityException, IOException {
        if (Files.isSymbolicLink(file)) {
            if (!policy.allowSymlinks()) {
                throw new SecurityException(file, "symbolic links are not allowed");
            }
            Path target = file.toRealPath();
            if (!target.startsWith(realRoot())) {
                throw new SecurityException(file, "symbolic link points outside " + policy.root());
            }
        }
        if (!Files.isRegularFile(file)) {
            throw new SecurityException(file, "not a regular file");
        }
        long size = Files.size(file);
        if (size > policy.maxFileSize()) {
            throw new SecurityException(file,
                    "file size " + size + " exceeds the limit of " + policy.maxFileSize() + " bytes");
        }
    }

    /**
     * Resolve an output path and make sure it stays inside the root, also
     * through symbolic links in the part of the path that already exists.
     *
     * @return the absolute, normalized output path
     */
    public Path checkOutput(Path output) throws SecurityException {
        Path absolute = policy.root().resolve(output).toAbsolutePath().normalize();
        if (!absolute.startsWith(policy.root())) {
            throw new SecurityException(absolute, "output path resolves outside " + policy.root());
        }
        if (Files.isDirectory(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new SecurityException(absolute, "output path is a directory");
        }
        Path existing = absolute;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing != null) {
            try {
                if (!existing.toRealPath().startsWith(realRoot())) {
                    throw new SecurityException(absolute, "output path resolves outside " + policy.root());
                }
            } catch (IOException e) {
                throw new SecurityException(absolute, "cannot resolve output path (" + e.getMessage() + ")");
            }
        }
        return absolute;
    }

    /**
     * Like {@link #checkOutput} for a directory that receives rewritten files.
     */
    public Path checkOutputDirectory(Path directory) throws SecurityException {
        Path absolute = policy.root().resolve(directory).toAbsolutePath().normalize();
        if (!absolute.startsWith(policy.root())) {
            throw new SecurityException(absolute, "output directory resolves outside " + policy.root());
        }
        if (Files.exists(absolute) && !Files.isDirectory(absolute)) {
            throw new SecurityException(absolute, "output directory exists but is not a directory");
        }
        return absolute;
    }

    private Path realRoot() throws IOException {
        Path root = policy.root();
        return Files.exists(root) ? root.toRealPath() : root;
    }
}

package com.raditha.twx.pipeline;

import com.raditha.twx.exceptions.NoFilesFoundException;
import com.raditha.twx.exceptions.PatternException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Expands include globs into a sorted, duplicate-free list of files.
 * <p>
 * Patterns are absolute or relative to the root directory. {@code **}
 * also matches zero directories, so {@code src/**}{@code /*.js} finds
 * {@code src/a.js}. A pattern without wildcards names a file, or a directory
 * whose whole tree is included. Symbolic links are listed but not followed;
 * the {@link SecurityGate} decides what to do with them.
 */
public class FileDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(FileDiscovery.class);

    private static final String GLOB_META = "*?[{";

    private final Path root;
    private final FileSystem fileSystem;

    public FileDiscovery(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.fileSystem = FileSystems.getDefault();
    }

    /**
     * @return matching files, absolute and sorted
     * @throws PatternException     if a pattern is not a valid glob
     * @throws NoFilesFoundException if nothing matches
     * @throws IOException          if a directory cannot be walked
     */
    public List<Path> discover(List<String> includes, List<String> excludes)
            throws PatternException, NoFilesFoundException, IOException {
        List<PathMatcher> excludeMatchers = new ArrayList<>();
        for (String pattern : excludes) {
            excludeMatchers.addAll(matchers(pattern));
        }

        TreeSet<Path> found = new TreeSet<>();
        for (String pattern : includes) {
            List<Path> matches = expand(pattern);
            logger.debug("Pattern {} matched {} file(s)", pattern, matches.size());
            found.addAll(matches);
        }
        found.removeIf(path -> excludeMatchers.stream().anyMatch(m -> m.matches(path)));

        if (found.isEmpty()) {
            throw new NoFilesFoundException(includes);
        }
        return List.copyOf(found);
    }

    /**
     * Display name of a discovered file: relative to the root when inside it.
     */
    public String identityOf(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (absolute.startsWith(root)) {
            return root.relativize(absolute).toString().replace('\\', '/');
        }
        return absolute.toString();
    }

    /**
     * Path of a discovered file below an output directory: its place relative
     * to the root, or just its name when it lives outside the root.
     */
    public Path relativeTarget(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        return absolute.startsWith(root) ? root.relativize(absolute) : absolute.getFileName();
    }

    public Path getRoot() {
        return root;
    }

    private List<Path> expand(String pattern) throws PatternException, IOException {
        String cleaned = strip(pattern);
        if (indexOfMeta(cleaned) < 0) {
            Path literal = root.resolve(cleaned).normalize();
            if (Files.isDirectory(literal, LinkOption.NOFOLLOW_LINKS)) {
                return walk(literal, List.of(path -> true));
            }
            return Files.exists(literal, LinkOption.NOFOLLOW_LINKS) ? List.of(literal) : List.of();
        }
        List<PathMatcher> patternMatchers = matchers(pattern);
        Path base = baseDirectory(cleaned);
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        return walk(base, patternMatchers);
    }

    private static List<Path> walk(Path base, List<PathMatcher> patternMatchers) throws IOException {
        try (Stream<Path> stream = Files.walk(base)) {
            return stream
                    .filter(p -> !Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))
                    .map(p -> p.toAbsolutePath().normalize())
                    .filter(p -> patternMatchers.stream().anyMatch(m -> m.matches(p)))
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Literal leading directories of the pattern, where walking starts.
     */
    private Path baseDirectory(String cleaned) {
        int meta = indexOfMeta(cleaned);
        String literal = cleaned.substring(0, meta);
        int slash = literal.lastIndexOf('/');
        String directory = slash < 0 ? "" : literal.substring(0, slash + 1);
        if (directory.isEmpty()) {
            return root;
        }
        return root.resolve(directory).normalize();
    }

    /**
     * Matchers for the absolute form of a pattern plus every variant in which
     * a {@code /**}{@code /} segment matches no directory at all.
     */
    private List<PathMatcher> matchers(String pattern) throws PatternException {
        String cleaned = strip(pattern);
        String absolute = Path.of(literalHead(cleaned)).isAbsolute()
                ? cleaned
                : escape(root.toString().replace('\\', '/')) + "/" + cleaned;
        List<PathMatcher> result = new ArrayList<>();
        try {
            for (String variant : collapsedVariants(absolute)) {
                result.add(fileSystem.getPathMatcher("glob:" + variant));
            }
        } catch (IllegalArgumentException e) {
            throw new PatternException(pattern, e);
        }
        return result;
    }

    static List<String> collapsedVariants(String pattern) {
        int index = pattern.indexOf("/**/");
        if (index < 0) {
            return List.of(pattern);
        }
        String head = pattern.substring(0, index);
        List<String> variants = new ArrayList<>();
        for (String tail : collapsedVariants(pattern.substring(index + 4))) {
            variants.add(head + "/**/" + tail);
            variants.add(head + "/" + tail);
        }
        return variants;
    }

    private static String strip(String pattern) {
        String cleaned = pattern.trim().replace('\\', '/');
        while (cleaned.startsWith("./")) {
            cleaned = cleaned.substring(2);
        }
        return cleaned;
    }

    private static String literalHead(String cleaned) {
        int meta = indexOfMeta(cleaned);
        return meta < 0 ? cleaned : cleaned.substring(0, meta);
    }

    private static int indexOfMeta(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (GLOB_META.indexOf(pattern.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    private static String escape(String literal) {
        StringBuilder out = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if ("*?[]{}\\".indexOf(c) >= 0) {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }
}

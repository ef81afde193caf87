package org.scout.core.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Walks a project tree and lazily yields source files.
 *
 * The returned stream is single-pass and holds open directory handles, so callers close it.
 */
public class SourceScanner {
    private static final Logger logger = LoggerFactory.getLogger(SourceScanner.class);

    public static final String SOURCE_EXTENSION = ".java";
    public static final List<String> DEFAULT_EXCLUDES =
            List.of("target", "build", "out", ".git", ".idea", ".gradle", "node_modules");

    private final Set<String> excludedDirectories;

    public SourceScanner() {
        this(DEFAULT_EXCLUDES);
    }

    public SourceScanner(Iterable<String> excludedDirectories) {
        this.excludedDirectories = new LinkedHashSet<>();
        excludedDirectories.forEach(this.excludedDirectories::add);
    }

    public Stream<SourceFile> scan(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Project root " + root + " does not exist or is not a directory");
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        logger.debug("Scanning {} (excluding {})", normalizedRoot, excludedDirectories);

        try {
            // sorted so two passes over an unchanged tree agree on ordering
            return Files.walk(normalizedRoot)
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                    .filter(p -> !isExcluded(normalizedRoot.relativize(p)))
                    .sorted(Comparator.comparing(p -> normalizedRoot.relativize(p).toString().replace('\\', '/')))
                    .map(p -> new SourceFile(normalizedRoot.relativize(p), read(p)));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to walk " + normalizedRoot, e);
        }
    }

    private boolean isExcluded(Path relative) {
        // the file name itself is never a directory
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (excludedDirectories.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + file, e);
        }
    }
}

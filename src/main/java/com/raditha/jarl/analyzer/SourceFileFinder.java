package com.raditha.jarl.analyzer;

import com.raditha.jarl.config.JarlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Expands the paths given on the command line into the R sources to lint.
 * <p>
 * Directories are walked recursively, skipping excluded paths. Files named
 * explicitly are always kept.
 */
public class SourceFileFinder {

    private static final Logger logger = LoggerFactory.getLogger(SourceFileFinder.class);

    private static final Set<String> EXTENSIONS = Set.of(".r", ".rmd", ".qmd");

    private final JarlConfig config;
    private final Path root;

    /**
     * @param config exclusion settings
     * @param root   directory exclusion patterns are relative to
     */
    public SourceFileFinder(JarlConfig config, Path root) {
        this.config = config;
        this.root = root.toAbsolutePath().normalize();
    }

    public static boolean isRSource(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    /**
     * Files to lint, sorted, without duplicates.
     */
    public List<Path> find(List<Path> paths) throws IOException {
        Set<Path> found = new LinkedHashSet<>();
        for (Path path : paths) {
            Path absolute = path.toAbsolutePath().normalize();
            if (Files.isDirectory(absolute)) {
                walk(absolute, found);
            } else if (Files.isRegularFile(absolute)) {
                found.add(absolute);
            } else {
                throw new IOException("No such file or directory: " + path);
            }
        }
        List<Path> sorted = new ArrayList<>(found);
        sorted.sort(null);
        return sorted;
    }

    private void walk(Path directory, Set<Path> found) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(directory) && isExcluded(dir, true)) {
                    logger.debug("Skipping excluded directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isRSource(file) && !isExcluded(file, false)) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private boolean isExcluded(Path path, boolean directory) {
        Path relative = path.startsWith(root) ? root.relativize(path) : path;
        String text = relative.toString().replace('\\', '/');
        return config.shouldExclude(directory ? text + "/" : text);
    }
}

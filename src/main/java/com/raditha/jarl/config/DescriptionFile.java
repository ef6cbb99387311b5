package com.raditha.jarl.config;

import com.raditha.jarl.model.RVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the R version requirement of an R package from its
 * {@code DESCRIPTION} file.
 */
public final class DescriptionFile {

    private static final Logger logger = LoggerFactory.getLogger(DescriptionFile.class);

    public static final String FILE_NAME = "DESCRIPTION";

    private static final Pattern R_DEPENDENCY = Pattern.compile("\\bR\\s*\\(\\s*>=?\\s*([0-9]+(?:\\.[0-9]+){1,2})\\s*\\)");

    private DescriptionFile() {
    }

    /**
     * The version in {@code Depends: R (>= x.y)}, if the directory holds a
     * DESCRIPTION file that declares one.
     */
    public static Optional<RVersion> minimumRVersion(Path directory) throws IOException {
        Path file = directory.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return parseDepends(Files.readAllLines(file));
    }

    /**
     * Extract the R requirement from the Depends field, including its
     * continuation lines.
     */
    static Optional<RVersion> parseDepends(List<String> lines) {
        StringBuilder depends = null;
        for (String line : lines) {
            if (depends == null) {
                if (line.startsWith("Depends:")) {
                    depends = new StringBuilder(line.substring("Depends:".length()));
                }
            } else if (!line.isEmpty() && Character.isWhitespace(line.charAt(0))) {
                depends.append(' ').append(line.trim());
            } else {
                break;
            }
        }
        if (depends == null) {
            return Optional.empty();
        }
        Matcher m = R_DEPENDENCY.matcher(depends);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(RVersion.parse(m.group(1)));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring malformed R version in DESCRIPTION: {}", m.group(1));
            return Optional.empty();
        }
    }
}

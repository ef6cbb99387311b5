package com.raditha.jarl.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Refuses to let fixes be written into files that git cannot restore.
 */
public class VersionControlGuard {

    private static final Logger logger = LoggerFactory.getLogger(VersionControlGuard.class);

    private static final long TIMEOUT_SECONDS = 30;

    private final boolean allowDirty;
    private final boolean allowNoVcs;

    public VersionControlGuard(boolean allowDirty, boolean allowNoVcs) {
        this.allowDirty = allowDirty;
        this.allowNoVcs = allowNoVcs;
    }

    /**
     * Check whether fixes may be written under {@code directory}.
     */
    public GuardResult check(Path directory) throws InterruptedException {
        if (allowNoVcs && allowDirty) {
            return GuardResult.permit();
        }

        CommandResult inside = run(directory, "git", "rev-parse", "--is-inside-work-tree");
        if (!inside.success() || !inside.output().trim().equals("true")) {
            if (allowNoVcs) {
                return GuardResult.permit();
            }
            return GuardResult.refuse("`" + directory + "` is not inside a git repository. "
                    + "Use --allow-no-vcs to apply fixes anyway.");
        }
        if (allowDirty) {
            return GuardResult.permit();
        }

        CommandResult status = run(directory, "git", "status", "--porcelain");
        if (!status.success()) {
            return GuardResult.refuse("Could not determine the git status of `" + directory + "`.");
        }
        List<String> dirty = new ArrayList<>();
        for (String line : status.output().split("\n")) {
            if (!line.isBlank()) {
                dirty.add(line.length() > 3 ? line.substring(3) : line.trim());
            }
        }
        if (dirty.isEmpty()) {
            return GuardResult.permit();
        }
        StringBuilder message = new StringBuilder("The working tree has uncommitted changes:\n");
        for (String file : dirty) {
            message.append("  - ").append(file).append('\n');
        }
        message.append("Commit or stash them, or use --allow-dirty to apply fixes anyway.");
        return GuardResult.refuse(message.toString());
    }

    /**
     * Run a command, collecting its combined output.
     */
    CommandResult run(Path directory, String... command) throws InterruptedException {
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(directory.toFile());
            pb.redirectErrorStream(true);

            Process process = pb.start();
            String output = readOutput(process);

            boolean finished = process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                logger.warn("`{}` timed out", String.join(" ", command));
                return new CommandResult(false, output);
            }
            return new CommandResult(process.exitValue() == 0, output);
        } catch (IOException e) {
            logger.debug("Failed to run {}: {}", command[0], e.getMessage());
            return new CommandResult(false, "");
        }
    }

    private String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        }
        return output.toString();
    }

    /**
     * Outcome of a guard check.
     */
    public record GuardResult(boolean allowed, String message) {
        static GuardResult permit() {
            return new GuardResult(true, "");
        }

        static GuardResult refuse(String message) {
            return new GuardResult(false, message);
        }
    }

    record CommandResult(boolean success, String output) {
    }
}

package com.raditha.jarl.analyzer;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.syntax.LineIndex;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of linting one file.
 *
 * @param path           the file
 * @param originalSource text as read from disk
 * @param source         text the diagnostics refer to; differs from
 *                       {@code originalSource} when fixes were applied
 * @param diagnostics    remaining diagnostics in report order
 * @param failure        why the file could not be analyzed, or null
 * @param fixesApplied   number of fixes applied over all passes
 * @param suppressed     number of diagnostics removed by suppression comments
 */
public record FileReport(
        Path path,
        String originalSource,
        String source,
        List<Diagnostic> diagnostics,
        @Nullable Diagnostic failure,
        int fixesApplied,
        int suppressed) {

    public FileReport {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Report for a file that could not be read or parsed.
     */
    public static FileReport failed(Path path, String source, Diagnostic failure) {
        return new FileReport(path, source, source, List.of(), failure, 0, 0);
    }

    public boolean isFailure() {
        return failure != null;
    }

    public boolean isFixed() {
        return !originalSource.equals(source);
    }

    /**
     * Line index over {@link #source()}, for 1-based locations.
     */
    public LineIndex lineIndex() {
        return LineIndex.of(source);
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        if (failure != null) {
            return String.format("%s: failed (%s)", path, failure.message());
        }
        return String.format("%s: %d diagnostic(s), %d fixed, %d suppressed",
                path, diagnostics.size(), fixesApplied, suppressed);
    }
}

package com.raditha.jarl.fix;

import com.raditha.jarl.model.Diagnostic;

import java.util.List;

/**
 * Outcome of one fix pass.
 *
 * @param text     the source after applying the accepted fixes
 * @param applied  diagnostics whose fix was applied
 * @param deferred eligible diagnostics whose fix conflicted with an earlier one
 */
public record FixResult(String text, List<Diagnostic> applied, List<Diagnostic> deferred) {

    public FixResult {
        applied = List.copyOf(applied);
        deferred = List.copyOf(deferred);
    }

    /**
     * The source unchanged: nothing was eligible.
     */
    public static FixResult unchanged(String text) {
        return new FixResult(text, List.of(), List.of());
    }

    public boolean hasChanges() {
        return !applied.isEmpty();
    }

    public boolean hasDeferred() {
        return !deferred.isEmpty();
    }
}

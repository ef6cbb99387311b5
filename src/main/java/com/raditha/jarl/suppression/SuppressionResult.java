package com.raditha.jarl.suppression;

import com.raditha.jarl.model.Diagnostic;

import java.util.List;

/**
 * Output of {@link SuppressionResolver#resolve}.
 *
 * @param diagnostics surviving diagnostics followed by the meta-diagnostics
 * @param directives  every directive found, with its final status
 * @param suppressed  number of raw diagnostics removed by a directive
 */
public record SuppressionResult(List<Diagnostic> diagnostics, List<SuppressionDirective> directives, int suppressed) {

    public SuppressionResult {
        diagnostics = List.copyOf(diagnostics);
        directives = List.copyOf(directives);
    }
}

package com.raditha.jarl.suppression;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.TextRange;

/**
 * Builds the diagnostics reported against suppression comments themselves.
 */
final class MetaDiagnostics {

    static final String BLANKET = "This comment isn't used by Jarl because it suppresses all possible violations "
            + "of this node.";
    static final String MISNAMED = "This comment isn't used by Jarl because it contains an unrecognized rule name.";
    static final String MISPLACED_FILE = "This comment isn't used by Jarl because `# jarl-ignore-file` must be at "
            + "the top of the file.";
    static final String MISPLACED = "This comment isn't used by Jarl because end-of-line suppressions are not "
            + "supported.";
    static final String OUTDATED = "This suppression comment is unused, no violation would be reported without it.";
    static final String UNEXPLAINED = "This comment isn't used by Jarl because it is missing an explanation.";
    static final String UNMATCHED_START = "This `jarl-ignore-start` has no matching `jarl-ignore-end` at the same "
            + "nesting level.";
    static final String UNMATCHED_END = "This `jarl-ignore-end` has no matching `jarl-ignore-start` at the same "
            + "nesting level.";
    static final String INVALID_CHUNK = "This `jarl-ignore-chunk` comment is wrongly formatted.";

    private MetaDiagnostics() {
    }

    /**
     * Name of the meta-rule that reports a directive with this status, null
     * for valid directives.
     */
    static String ruleFor(DirectiveStatus status) {
        return switch (status) {
            case VALID -> null;
            case BLANKET -> RuleNames.BLANKET_SUPPRESSION;
            case MISNAMED -> RuleNames.MISNAMED_SUPPRESSION;
            case UNEXPLAINED -> RuleNames.UNEXPLAINED_SUPPRESSION;
            case MISPLACED -> RuleNames.MISPLACED_SUPPRESSION;
            case MISPLACED_FILE -> RuleNames.MISPLACED_FILE_SUPPRESSION;
            case UNMATCHED -> RuleNames.UNMATCHED_RANGE_SUPPRESSION;
            case INVALID_CHUNK -> RuleNames.INVALID_CHUNK_SUPPRESSION;
        };
    }

    static Diagnostic forDirective(SuppressionDirective directive) {
        TextRange range = directive.range();
        return switch (directive.status()) {
            case BLANKET -> diagnostic(RuleNames.BLANKET_SUPPRESSION, BLANKET,
                    "Use targeted comments instead, e.g., `# jarl-ignore any_is_na: <explanation>`.", range);
            case MISNAMED -> diagnostic(RuleNames.MISNAMED_SUPPRESSION, MISNAMED,
                    "Check the rule name for typos.", range);
            case UNEXPLAINED -> diagnostic(RuleNames.UNEXPLAINED_SUPPRESSION, UNEXPLAINED,
                    "Add an explanation after the colon, e.g., `# jarl-ignore rule: <reason>`.", range);
            case MISPLACED -> diagnostic(RuleNames.MISPLACED_SUPPRESSION, MISPLACED,
                    "Move the suppression comment to its own line above the code you want to suppress.", range);
            case MISPLACED_FILE -> diagnostic(RuleNames.MISPLACED_FILE_SUPPRESSION, MISPLACED_FILE,
                    "Move this comment to the beginning of the file, before any code.", range);
            case UNMATCHED -> directive.kind() == DirectiveKind.RANGE_END
                    ? diagnostic(RuleNames.UNMATCHED_RANGE_SUPPRESSION, UNMATCHED_END,
                            "Add a matching `jarl-ignore-start` comment at the same nesting level.", range)
                    : diagnostic(RuleNames.UNMATCHED_RANGE_SUPPRESSION, UNMATCHED_START,
                            "Add a matching `jarl-ignore-end` comment at the same nesting level.", range);
            case INVALID_CHUNK -> diagnostic(RuleNames.INVALID_CHUNK_SUPPRESSION, INVALID_CHUNK,
                    "Use the YAML array form instead:\n#| jarl-ignore-chunk:\n#|   - <rule>: <reason>", range);
            case VALID -> throw new IllegalArgumentException("Valid directives are not reported");
        };
    }

    static Diagnostic outdated(SuppressionDirective directive) {
        return diagnostic(RuleNames.OUTDATED_SUPPRESSION, OUTDATED,
                "Remove this suppression comment or verify that it's still needed.", directive.range());
    }

    private static Diagnostic diagnostic(String rule, String message, String suggestion, TextRange range) {
        return Diagnostic.of(rule, message, range).withSuggestion(suggestion);
    }
}

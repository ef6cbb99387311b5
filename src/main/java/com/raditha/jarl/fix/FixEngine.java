package com.raditha.jarl.fix;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.Fix;
import com.raditha.jarl.model.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges the fixes of a set of diagnostics and applies them to the source.
 * <p>
 * Fixes are considered in source order. A fix is accepted only when none of
 * its edits conflicts with an edit already accepted; the others are deferred
 * to a later pass over the re-linted text.
 */
public class FixEngine {

    private static final Logger logger = LoggerFactory.getLogger(FixEngine.class);

    /**
     * Upper bound on lint and fix passes over one file.
     */
    public static final int MAX_PASSES = 10;

    private static final Comparator<TextEdit> APPLY_ORDER = Comparator
            .comparingInt((TextEdit e) -> e.range().start())
            .thenComparingInt(e -> e.range().end())
            .reversed();

    private final FixPolicy policy;

    public FixEngine(FixPolicy policy) {
        this.policy = policy;
    }

    public FixPolicy policy() {
        return policy;
    }

    /**
     * Applies every eligible, non-conflicting fix in one pass.
     *
     * @param source      the text the diagnostics were computed on
     * @param diagnostics diagnostics of that text, in any order
     */
    public FixResult apply(String source, List<Diagnostic> diagnostics) {
        List<Diagnostic> eligible = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.hasFix() && policy.accepts(diagnostic.fixSafety())) {
                eligible.add(diagnostic);
            }
        }
        if (eligible.isEmpty()) {
            return FixResult.unchanged(source);
        }
        eligible.sort(Diagnostic.SOURCE_ORDER);

        List<Diagnostic> applied = new ArrayList<>();
        List<Diagnostic> deferred = new ArrayList<>();
        List<Fix> accepted = new ArrayList<>();
        for (Diagnostic diagnostic : eligible) {
            Fix fix = diagnostic.fix();
            if (accepted.stream().anyMatch(fix::conflictsWith)) {
                deferred.add(diagnostic);
            } else {
                accepted.add(fix);
                applied.add(diagnostic);
            }
        }

        List<TextEdit> edits = new ArrayList<>();
        for (Fix fix : accepted) {
            edits.addAll(fix.edits());
        }
        edits.sort(APPLY_ORDER);

        StringBuilder text = new StringBuilder(source);
        for (TextEdit edit : edits) {
            text.replace(edit.range().start(), edit.range().end(), edit.replacement());
        }
        if (!deferred.isEmpty()) {
            logger.debug("Applied {} fix(es), deferred {} conflicting fix(es)", applied.size(), deferred.size());
        }
        return new FixResult(text.toString(), applied, deferred);
    }
}

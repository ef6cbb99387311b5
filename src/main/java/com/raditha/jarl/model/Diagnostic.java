package com.raditha.jarl.model;

import com.raditha.jarl.syntax.TextRange;
import org.jspecify.annotations.Nullable;

import java.util.Comparator;

/**
 * A rule violation at a source range, optionally carrying a fix.
 *
 * @param rule       rule name, e.g. {@code any_is_na}
 * @param message    what is wrong
 * @param suggestion how to resolve it, may be null
 * @param range      offending source range
 * @param fix        automatic fix, may be null
 * @param fixSafety  safety of {@code fix}; NONE exactly when there is no fix
 */
public record Diagnostic(
        String rule,
        String message,
        @Nullable String suggestion,
        TextRange range,
        @Nullable Fix fix,
        FixSafety fixSafety) {

    /**
     * Source order, ties broken by rule name.
     */
    public static final Comparator<Diagnostic> SOURCE_ORDER = Comparator
            .comparingInt((Diagnostic d) -> d.range().start())
            .thenComparing(Diagnostic::rule);

    public Diagnostic {
        if (rule == null || message == null || range == null) {
            throw new IllegalArgumentException("rule, message and range are required");
        }
        if (fix == null) {
            fixSafety = FixSafety.NONE;
        } else if (fixSafety == null || fixSafety == FixSafety.NONE) {
            throw new IllegalArgumentException("A fix must be tagged SAFE or UNSAFE");
        }
    }

    public static Diagnostic of(String rule, String message, TextRange range) {
        return new Diagnostic(rule, message, null, range, null, FixSafety.NONE);
    }

    public Diagnostic withSuggestion(String text) {
        return new Diagnostic(rule, message, text, range, fix, fixSafety);
    }

    public Diagnostic withFix(Fix newFix, FixSafety safety) {
        return new Diagnostic(rule, message, suggestion, range, newFix, safety);
    }

    public Diagnostic withoutFix() {
        return new Diagnostic(rule, message, suggestion, range, null, FixSafety.NONE);
    }

    /**
     * Same diagnostic moved by {@code delta} characters, fix included.
     */
    public Diagnostic shift(int delta) {
        Fix shifted = null;
        if (fix != null) {
            shifted = new Fix(fix.edits().stream()
                    .map(e -> new TextEdit(shift(e.range(), delta), e.replacement()))
                    .toList());
        }
        return new Diagnostic(rule, message, suggestion, shift(range, delta), shifted, fixSafety);
    }

    private static TextRange shift(TextRange r, int delta) {
        return new TextRange(r.start() + delta, r.end() + delta);
    }

    public boolean hasFix() {
        return fix != null;
    }

    public int start() {
        return range.start();
    }
}

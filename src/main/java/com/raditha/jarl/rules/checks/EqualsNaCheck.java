package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.Fix;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.rules.AnalysisContext;
import com.raditha.jarl.rules.RuleCheck;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.SyntaxKind;
import com.raditha.jarl.syntax.SyntaxNode;
import com.raditha.jarl.util.SyntaxUtility;

import java.util.Optional;

/**
 * Flags {@code x == NA}, {@code x != NA} and {@code x %in% NA}: comparing
 * with NA always yields NA.
 */
public class EqualsNaCheck implements RuleCheck {

    static final String MESSAGE = "Comparing to NA with `==`, `!=` or `%in%` is problematic.";
    static final String SUGGESTION = "Use `is.na()` instead.";

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        if (!SyntaxUtility.isComparison(node, "==", "!=", "%in%")) {
            return Optional.empty();
        }
        SyntaxNode tested;
        if (node.right().is(SyntaxKind.NA)) {
            tested = node.left();
        } else if (node.left().is(SyntaxKind.NA) && !"%in%".equals(node.operator())) {
            tested = node.right();
        } else {
            return Optional.empty();
        }

        Diagnostic diagnostic = Diagnostic.of(RuleNames.EQUALS_NA, MESSAGE, node.range()).withSuggestion(SUGGESTION);
        if (context.hasComments(node)) {
            return Optional.of(diagnostic);
        }
        String negation = "!=".equals(node.operator()) ? "!" : "";
        String replacement = negation + "is.na(" + context.text(tested) + ")";
        return Optional.of(diagnostic.withFix(Fix.replace(node.range(), replacement), FixSafety.SAFE));
    }
}

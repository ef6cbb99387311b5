package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.Fix;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.rules.AnalysisContext;
import com.raditha.jarl.rules.RuleCheck;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.SyntaxNode;
import com.raditha.jarl.util.SyntaxUtility;

import java.util.Optional;

/**
 * Flags {@code T} and {@code F} used as values. Both are ordinary variables
 * that can be reassigned.
 */
public class TrueFalseSymbolCheck implements RuleCheck {

    static final String MESSAGE = "`T` and `F` can be confused with variables.";
    static final String SUGGESTION = "Use `TRUE` and `FALSE` instead.";

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        String name = node.text();
        if (!"T".equals(name) && !"F".equals(name)) {
            return Optional.empty();
        }
        // Backticked `T` is deliberate.
        if (node.range().length() != 1 || !isValueUse(node)) {
            return Optional.empty();
        }
        String replacement = "T".equals(name) ? "TRUE" : "FALSE";
        return Optional.of(Diagnostic.of(RuleNames.TRUE_FALSE_SYMBOL, MESSAGE, node.range())
                .withSuggestion(SUGGESTION)
                .withFix(Fix.replace(node.range(), replacement), FixSafety.SAFE));
    }

    private static boolean isValueUse(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent == null) {
            return true;
        }
        return switch (parent.kind()) {
            case NAMESPACE_EXPRESSION -> false;
            case FOR_STATEMENT -> parent.variable() != node;
            case CALL -> parent.function() != node;
            case BINARY_EXPRESSION -> {
                String operator = parent.operator();
                if (("$".equals(operator) || "@".equals(operator)) && parent.right() == node) {
                    yield false;
                }
                yield !SyntaxUtility.isAssignmentTarget(node);
            }
            default -> true;
        };
    }
}

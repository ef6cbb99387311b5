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
 * Flags {@code any(is.na(x))} and {@code NA %in% x}, both of which are
 * slower spellings of {@code anyNA(x)}.
 */
public class AnyIsNaCheck implements RuleCheck {

    static final String MESSAGE = "`any(is.na(...))` is inefficient.";
    static final String SUGGESTION = "Use `anyNA(...)` instead.";

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        Optional<SyntaxNode> tested = node.is(SyntaxKind.CALL) ? matchAnyIsNa(node) : matchNaIn(node);
        return tested.map(x -> {
            Diagnostic diagnostic = Diagnostic.of(RuleNames.ANY_IS_NA, MESSAGE, node.range())
                    .withSuggestion(SUGGESTION);
            if (context.hasComments(node)) {
                return diagnostic;
            }
            return diagnostic.withFix(Fix.replace(node.range(), "anyNA(" + context.text(x) + ")"), FixSafety.SAFE);
        });
    }

    private static Optional<SyntaxNode> matchAnyIsNa(SyntaxNode call) {
        if (!call.isCallTo("any")) {
            return Optional.empty();
        }
        return SyntaxUtility.singlePositionalArgument(call)
                .filter(inner -> inner.isCallTo("is.na"))
                .flatMap(SyntaxUtility::singlePositionalArgument);
    }

    private static Optional<SyntaxNode> matchNaIn(SyntaxNode binary) {
        if (!"%in%".equals(binary.operator()) || !binary.left().is(SyntaxKind.NA)
                || !"NA".equals(binary.left().text())) {
            return Optional.empty();
        }
        return Optional.of(binary.right());
    }
}

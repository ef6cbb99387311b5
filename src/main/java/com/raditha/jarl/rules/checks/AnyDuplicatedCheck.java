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
 * Flags {@code any(duplicated(x))}.
 */
public class AnyDuplicatedCheck implements RuleCheck {

    static final String MESSAGE = "`any(duplicated(...))` is inefficient.";
    static final String SUGGESTION = "Use `anyDuplicated(...) > 0` instead.";

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        if (!node.isCallTo("any")) {
            return Optional.empty();
        }
        return SyntaxUtility.singlePositionalArgument(node)
                .filter(inner -> inner.isCallTo("duplicated"))
                .flatMap(SyntaxUtility::singlePositionalArgument)
                .map(x -> {
                    Diagnostic diagnostic = Diagnostic.of(RuleNames.ANY_DUPLICATED, MESSAGE, node.range())
                            .withSuggestion(SUGGESTION);
                    if (context.hasComments(node)) {
                        return diagnostic;
                    }
                    String replacement = "anyDuplicated(" + context.text(x) + ") > 0";
                    return diagnostic.withFix(Fix.replace(node.range(), replacement), FixSafety.SAFE);
                });
    }
}

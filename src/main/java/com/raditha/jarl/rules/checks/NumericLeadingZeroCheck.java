package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.Fix;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.rules.AnalysisContext;
import com.raditha.jarl.rules.RuleCheck;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Flags fractional constants written without a leading zero, such as {@code .5}.
 */
public class NumericLeadingZeroCheck implements RuleCheck {

    static final String MESSAGE = "Include the leading zero for fractional numeric constants.";

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        String text = node.text();
        if (text == null || !text.startsWith(".")) {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.of(RuleNames.NUMERIC_LEADING_ZERO, MESSAGE, node.range())
                .withFix(Fix.replace(node.range(), "0" + text), FixSafety.SAFE));
    }
}

package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.AnalysisContext;
import com.raditha.jarl.rules.RuleCheck;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Flags leftover {@code browser()} calls.
 */
public class BrowserCheck implements RuleCheck {

    static final String MESSAGE = "Calls to `browser()` should be removed.";

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        if (!node.isCallTo("browser")) {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.of(RuleNames.BROWSER, MESSAGE, node.range()));
    }
}

package com.raditha.jarl.rules;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.Optional;

/**
 * A node-local check. Implementations must not keep state between calls and
 * must not depend on other rules' results.
 */
@FunctionalInterface
public interface RuleCheck {

    /**
     * Inspect one node.
     *
     * @param node    node of a kind the check was registered for
     * @param context read-only view of the surrounding tree
     * @return a diagnostic when the node violates the rule
     */
    Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context);
}

package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.AnalysisContext;
import com.raditha.jarl.rules.RuleCheck;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Reports each unreachable region once, when the traversal reaches the
 * region's first statement.
 */
public class UnreachableCodeCheck implements RuleCheck {

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        return context.unreachableRegionAt(node)
                .map(region -> Diagnostic.of(RuleNames.UNREACHABLE_CODE, region.reason().message(), region.range()));
    }
}

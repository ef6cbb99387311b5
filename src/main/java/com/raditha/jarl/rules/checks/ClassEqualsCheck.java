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
 * Flags {@code class(x) == "a"} style tests. Objects can carry several
 * classes, so {@code inherits()} is the reliable test. The fix is unsafe
 * because the comparison is vectorized while {@code inherits()} is not.
 */
public class ClassEqualsCheck implements RuleCheck {

    static final String MESSAGE = "Comparing `class(x)` with `==` or `%in%` can be problematic.";
    static final String SUGGESTION = "Use `inherits(x, 'a')` instead.";

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        if (!SyntaxUtility.isComparison(node, "==", "!=", "%in%")) {
            return Optional.empty();
        }
        // The result may be used as a vector; nothing to say about its use.
        if (SyntaxUtility.isAssignedValue(node)) {
            return Optional.empty();
        }

        SyntaxNode classCall;
        SyntaxNode literal;
        if (isClassCall(node.left()) && node.right().is(SyntaxKind.STRING)) {
            classCall = node.left();
            literal = node.right();
        } else if (isClassCall(node.right()) && node.left().is(SyntaxKind.STRING)) {
            classCall = node.right();
            literal = node.left();
        } else {
            return Optional.empty();
        }

        Diagnostic diagnostic = Diagnostic.of(RuleNames.CLASS_EQUALS, MESSAGE, node.range())
                .withSuggestion(SUGGESTION);
        if (context.hasComments(node)) {
            return Optional.of(diagnostic);
        }
        SyntaxNode object = SyntaxUtility.singlePositionalArgument(classCall).orElseThrow();
        String negation = "!=".equals(node.operator()) ? "!" : "";
        String replacement = negation + "inherits(" + context.text(object) + ", " + context.text(literal) + ")";
        return Optional.of(diagnostic.withFix(Fix.replace(node.range(), replacement), FixSafety.UNSAFE));
    }

    private static boolean isClassCall(SyntaxNode node) {
        return node.isCallTo("class") && SyntaxUtility.singlePositionalArgument(node).isPresent();
    }
}

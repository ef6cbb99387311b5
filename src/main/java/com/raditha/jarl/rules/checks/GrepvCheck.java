package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.Fix;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.model.TextEdit;
import com.raditha.jarl.rules.AnalysisContext;
import com.raditha.jarl.rules.RuleCheck;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.SyntaxKind;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Flags {@code grep(..., value = TRUE)}, which R 4.5 spells {@code grepv(...)}.
 */
public class GrepvCheck implements RuleCheck {

    static final String MESSAGE = "`grep(..., value = TRUE)` can be simplified.";
    static final String SUGGESTION = "Use `grepv(...)` instead.";

    private static final List<String> FORMALS = List.of(
            "pattern", "x", "ignore.case", "perl", "value", "fixed", "useBytes", "invert");

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        if (!node.isCallTo("grep")) {
            return Optional.empty();
        }
        Map<SyntaxNode, String> matched = matchArguments(node.arguments());
        SyntaxNode valueArgument = null;
        for (Map.Entry<SyntaxNode, String> entry : matched.entrySet()) {
            if ("value".equals(entry.getValue())) {
                valueArgument = entry.getKey();
            }
        }
        if (valueArgument == null || valueArgument.value().filter(v -> v.is(SyntaxKind.TRUE)).isEmpty()) {
            return Optional.empty();
        }

        Diagnostic diagnostic = Diagnostic.of(RuleNames.GREPV, MESSAGE, node.range()).withSuggestion(SUGGESTION);
        if (context.hasComments(node)) {
            return Optional.of(diagnostic);
        }

        SyntaxNode callee = node.function();
        SyntaxNode name = callee.is(SyntaxKind.NAMESPACE_EXPRESSION) ? callee.right() : callee;
        SyntaxNode removed = valueArgument;
        String remaining = node.arguments().stream()
                .filter(a -> a != removed)
                .map(context::text)
                .collect(Collectors.joining(", "));
        Fix fix = new Fix(List.of(
                new TextEdit(name.range(), "grepv"),
                new TextEdit(node.argumentList().range(), "(" + remaining + ")")));
        return Optional.of(diagnostic.withFix(fix, FixSafety.SAFE));
    }

    /**
     * Bind arguments to grep's formals the way R does: exact names first,
     * then positional arguments fill the remaining formals in order.
     */
    private static Map<SyntaxNode, String> matchArguments(List<SyntaxNode> arguments) {
        Map<SyntaxNode, String> result = new IdentityHashMap<>();
        List<String> free = new ArrayList<>(FORMALS);
        for (SyntaxNode argument : arguments) {
            argument.name().filter(free::remove).ifPresent(n -> result.put(argument, n));
        }
        for (SyntaxNode argument : arguments) {
            if (argument.name().isEmpty() && !free.isEmpty()) {
                result.put(argument, free.remove(0));
            }
        }
        return result;
    }
}

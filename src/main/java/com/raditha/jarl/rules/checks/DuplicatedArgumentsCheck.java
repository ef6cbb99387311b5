package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.AnalysisContext;
import com.raditha.jarl.rules.RuleCheck;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags calls that pass the same named argument more than once.
 */
public class DuplicatedArgumentsCheck implements RuleCheck {

    static final String MESSAGE_PREFIX = "Avoid duplicate arguments in function calls. Duplicated argument(s): ";

    /**
     * Functions where repeating a name is legitimate (it names output columns
     * or list elements).
     */
    static final Set<String> ALLOWED_FUNCTIONS = Set.of(
            "c", "mutate", "summarize", "summarise", "transmute", "cli_format_each_inline");

    @Override
    public Optional<Diagnostic> check(SyntaxNode node, AnalysisContext context) {
        Optional<String> callee = node.calleeName();
        if (callee.isPresent() && ALLOWED_FUNCTIONS.contains(callee.get())) {
            return Optional.empty();
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicated = new LinkedHashSet<>();
        for (SyntaxNode argument : node.arguments()) {
            argument.name().ifPresent(name -> {
                if (!seen.add(name)) {
                    duplicated.add(name);
                }
            });
        }
        if (duplicated.isEmpty()) {
            return Optional.empty();
        }
        String names = duplicated.stream().map(n -> "\"" + n + "\"").collect(Collectors.joining(", "));
        return Optional.of(Diagnostic.of(RuleNames.DUPLICATED_ARGUMENTS, MESSAGE_PREFIX + names + ".", node.range()));
    }
}

package com.raditha.jarl.rules;

import com.raditha.jarl.rules.checks.AnyDuplicatedCheck;
import com.raditha.jarl.rules.checks.AnyIsNaCheck;
import com.raditha.jarl.rules.checks.BrowserCheck;
import com.raditha.jarl.rules.checks.ClassEqualsCheck;
import com.raditha.jarl.rules.checks.DuplicatedArgumentsCheck;
import com.raditha.jarl.rules.checks.EqualsNaCheck;
import com.raditha.jarl.rules.checks.GrepvCheck;
import com.raditha.jarl.rules.checks.NumericLeadingZeroCheck;
import com.raditha.jarl.rules.checks.TrueFalseSymbolCheck;
import com.raditha.jarl.rules.checks.UnreachableCodeCheck;
import com.raditha.jarl.syntax.SyntaxKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps node kinds to the checks that want to see them. Checks are kept in
 * registration order, which is also their invocation order.
 */
public final class RuleRegistry {

    /**
     * A check bound to its rule metadata.
     */
    public record RegisteredCheck(RuleDefinition rule, RuleCheck check) {
    }

    private final RuleTable table;
    private final Map<SyntaxKind, List<RegisteredCheck>> checks = new EnumMap<>(SyntaxKind.class);

    public RuleRegistry(RuleTable table) {
        this.table = table;
    }

    /**
     * Registry holding every built-in check.
     */
    public static RuleRegistry defaults(RuleTable table) {
        RuleRegistry registry = new RuleRegistry(table);
        registry.register(RuleNames.ANY_IS_NA, new AnyIsNaCheck(), SyntaxKind.CALL, SyntaxKind.BINARY_EXPRESSION);
        registry.register(RuleNames.ANY_DUPLICATED, new AnyDuplicatedCheck(), SyntaxKind.CALL);
        registry.register(RuleNames.BROWSER, new BrowserCheck(), SyntaxKind.CALL);
        registry.register(RuleNames.CLASS_EQUALS, new ClassEqualsCheck(), SyntaxKind.BINARY_EXPRESSION);
        registry.register(RuleNames.DUPLICATED_ARGUMENTS, new DuplicatedArgumentsCheck(), SyntaxKind.CALL);
        registry.register(RuleNames.EQUALS_NA, new EqualsNaCheck(), SyntaxKind.BINARY_EXPRESSION);
        registry.register(RuleNames.GREPV, new GrepvCheck(), SyntaxKind.CALL);
        registry.register(RuleNames.NUMERIC_LEADING_ZERO, new NumericLeadingZeroCheck(), SyntaxKind.NUMBER);
        registry.register(RuleNames.TRUE_FALSE_SYMBOL, new TrueFalseSymbolCheck(), SyntaxKind.IDENTIFIER);
        registry.register(RuleNames.UNREACHABLE_CODE, new UnreachableCodeCheck(), SyntaxKind.values());
        return registry;
    }

    /**
     * Register a check for one or more node kinds.
     *
     * @throws IllegalArgumentException if the rule is not in the table
     */
    public RuleRegistry register(String ruleName, RuleCheck check, SyntaxKind... kinds) {
        RuleDefinition definition = table.require(ruleName);
        for (SyntaxKind kind : kinds) {
            checks.computeIfAbsent(kind, k -> new ArrayList<>()).add(new RegisteredCheck(definition, check));
        }
        return this;
    }

    public List<RegisteredCheck> checksFor(SyntaxKind kind) {
        return Collections.unmodifiableList(checks.getOrDefault(kind, List.of()));
    }
}

package com.raditha.jarl.config;

import com.raditha.jarl.rules.RuleDefinition;
import com.raditha.jarl.rules.RuleTable;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves selectors (rule names, categories or {@code ALL}) to rule names.
 */
public final class RuleSelection {

    public static final String ALL = "ALL";

    private RuleSelection() {
    }

    /**
     * Rules to run.
     *
     * @param select       replaces the default selection when not empty
     * @param extendSelect added to the selection
     * @param ignore       removed from the selection
     * @return rule names in table order
     * @throws ConfigurationException if a selector names no rule or category
     */
    public static Set<String> enabledRules(RuleTable table, List<String> select, List<String> extendSelect,
            List<String> ignore) {
        Set<String> selected = new LinkedHashSet<>();
        if (select.isEmpty()) {
            for (RuleDefinition rule : table.rules()) {
                if (rule.enabledByDefault()) {
                    selected.add(rule.name());
                }
            }
        } else {
            selected.addAll(expand(table, select, "select"));
        }
        selected.addAll(expand(table, extendSelect, "extend-select"));
        selected.removeAll(expand(table, ignore, "ignore"));
        return inTableOrder(table, selected);
    }

    /**
     * Rules whose fixes may be applied.
     *
     * @param fixable   restricts fixing to these when not empty
     * @param unfixable never fixed
     */
    public static Set<String> fixableRules(RuleTable table, List<String> fixable, List<String> unfixable) {
        Set<String> result = new LinkedHashSet<>();
        if (fixable.isEmpty()) {
            result.addAll(table.names());
        } else {
            result.addAll(expand(table, fixable, "fixable"));
        }
        result.removeAll(expand(table, unfixable, "unfixable"));
        return inTableOrder(table, result);
    }

    static Set<String> expand(RuleTable table, Collection<String> selectors, String option) {
        Set<String> names = new LinkedHashSet<>();
        for (String raw : selectors) {
            String selector = raw.trim();
            if (selector.isEmpty()) {
                continue;
            }
            if (ALL.equals(selector)) {
                names.addAll(table.names());
            } else if (table.contains(selector)) {
                names.add(selector);
            } else if (table.isCategory(selector)) {
                table.inCategory(selector).forEach(rule -> names.add(rule.name()));
            } else {
                throw new ConfigurationException(
                        "Unknown rule or category `" + selector + "` in `" + option + "`");
            }
        }
        return names;
    }

    private static Set<String> inTableOrder(RuleTable table, Set<String> names) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String name : table.names()) {
            if (names.contains(name)) {
                ordered.add(name);
            }
        }
        return ordered;
    }
}

package com.raditha.jarl.rules;

import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.model.RVersion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.raditha.jarl.rules.RuleNames.*;

/**
 * Immutable catalogue of every known rule. Built once and passed explicitly to
 * whoever needs rule metadata.
 */
public final class RuleTable {

    public static final String SUPPRESSION_CATEGORY = "SUPP";

    private static final RuleTable DEFAULT = builder()
            .add(ANY_DUPLICATED, "PERF", true, FixSafety.SAFE, null)
            .add(ANY_IS_NA, "PERF", true, FixSafety.SAFE, null)
            .add(BROWSER, "CORR", true, FixSafety.NONE, null)
            .add(CLASS_EQUALS, "SUSP", true, FixSafety.UNSAFE, null)
            .add(DUPLICATED_ARGUMENTS, "SUSP", true, FixSafety.NONE, null)
            .add(EQUALS_NA, "CORR", true, FixSafety.SAFE, null)
            .add(GREPV, "READ", true, FixSafety.SAFE, new RVersion(4, 5, 0))
            .add(NUMERIC_LEADING_ZERO, "READ", true, FixSafety.SAFE, null)
            .add(TRUE_FALSE_SYMBOL, "READ", true, FixSafety.SAFE, null)
            .add(UNREACHABLE_CODE, "SUSP", true, FixSafety.NONE, null)
            .add(BLANKET_SUPPRESSION, SUPPRESSION_CATEGORY, true, FixSafety.NONE, null)
            .add(MISNAMED_SUPPRESSION, SUPPRESSION_CATEGORY, true, FixSafety.NONE, null)
            .add(MISPLACED_SUPPRESSION, SUPPRESSION_CATEGORY, true, FixSafety.NONE, null)
            .add(MISPLACED_FILE_SUPPRESSION, SUPPRESSION_CATEGORY, true, FixSafety.NONE, null)
            .add(UNEXPLAINED_SUPPRESSION, SUPPRESSION_CATEGORY, true, FixSafety.NONE, null)
            .add(UNMATCHED_RANGE_SUPPRESSION, SUPPRESSION_CATEGORY, true, FixSafety.NONE, null)
            .add(OUTDATED_SUPPRESSION, SUPPRESSION_CATEGORY, true, FixSafety.NONE, null)
            .add(INVALID_CHUNK_SUPPRESSION, SUPPRESSION_CATEGORY, true, FixSafety.NONE, null)
            .build();

    private final Map<String, RuleDefinition> rules;

    private RuleTable(Map<String, RuleDefinition> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * The built-in rule catalogue.
     */
    public static RuleTable defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RuleDefinition> get(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public RuleDefinition require(String name) {
        RuleDefinition definition = rules.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown rule: " + name);
        }
        return definition;
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    public Set<String> names() {
        return rules.keySet();
    }

    public List<RuleDefinition> rules() {
        return List.copyOf(rules.values());
    }

    /**
     * Rules tagged with the given category, in table order.
     */
    public List<RuleDefinition> inCategory(String category) {
        List<RuleDefinition> result = new ArrayList<>();
        for (RuleDefinition definition : rules.values()) {
            if (definition.isInCategory(category)) {
                result.add(definition);
            }
        }
        return result;
    }

    public boolean isCategory(String name) {
        return rules.values().stream().anyMatch(r -> r.isInCategory(name));
    }

    public static final class Builder {
        private final Map<String, RuleDefinition> rules = new LinkedHashMap<>();

        public Builder add(String name, String categories, boolean enabledByDefault, FixSafety fixSafety,
                RVersion minimumRVersion) {
            return add(new RuleDefinition(name, List.of(categories.split(",")), enabledByDefault, fixSafety,
                    minimumRVersion));
        }

        public Builder add(RuleDefinition definition) {
            if (rules.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate rule: " + definition.name());
            }
            return this;
        }

        public RuleTable build() {
            return new RuleTable(rules);
        }
    }
}

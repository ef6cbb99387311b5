package com.raditha.jarl.rules;

import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.model.RVersion;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Static metadata of one rule.
 *
 * @param name             unique rule name
 * @param categories       category tags usable in rule selection (PERF, READ...)
 * @param enabledByDefault whether the rule runs without an explicit selection
 * @param fixSafety        safety of the rule's fixes, NONE for rules without fixes
 * @param minimumRVersion  R version the rule's suggestion needs, or null
 */
public record RuleDefinition(
        String name,
        List<String> categories,
        boolean enabledByDefault,
        FixSafety fixSafety,
        @Nullable RVersion minimumRVersion) {

    public RuleDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name cannot be blank");
        }
        categories = List.copyOf(categories);
        if (fixSafety == null) {
            fixSafety = FixSafety.NONE;
        }
    }

    public boolean hasFix() {
        return fixSafety != FixSafety.NONE;
    }

    public boolean isInCategory(String category) {
        return categories.contains(category);
    }

    /**
     * Whether the rule may run for a project targeting {@code projectVersion}.
     * Rules with a minimum version are skipped when the project version is
     * unknown.
     */
    public boolean supports(@Nullable RVersion projectVersion) {
        if (minimumRVersion == null) {
            return true;
        }
        return projectVersion != null && projectVersion.isAtLeast(minimumRVersion);
    }
}

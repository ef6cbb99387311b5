package com.raditha.jarl.rules;

import com.raditha.jarl.cfg.CfgBuilder;

import java.util.List;

/**
 * Per-rule settings resolved from configuration.
 *
 * @param stoppingFunctions functions treated as never returning by
 *                          {@code unreachable_code}
 */
public record RuleOptions(List<String> stoppingFunctions) {

    public RuleOptions {
        stoppingFunctions = List.copyOf(stoppingFunctions);
    }

    public static RuleOptions defaults() {
        return new RuleOptions(CfgBuilder.DEFAULT_STOPPING_FUNCTIONS);
    }
}

package com.urdfix.core.analyzer;

import java.util.Arrays;
import java.util.Set;

/**
 * Selects which lint rules run.
 *
 * @param disabledRules ids of rules that are skipped
 */
public record LintSettings(Set<String> disabledRules) {

    public LintSettings {
        disabledRules = disabledRules == null ? Set.of() : Set.copyOf(disabledRules);
    }

    /**
     * Creates settings with every rule enabled.
     *
     * @return default settings
     */
    public static LintSettings defaults() {
        return new LintSettings(Set.of());
    }

    /**
     * Creates settings with the given rules disabled.
     *
     * @param ruleIds ids of rules to skip
     * @return settings
     */
    public static LintSettings disabling(String... ruleIds) {
        return new LintSettings(Set.copyOf(Arrays.asList(ruleIds)));
    }

    public boolean isEnabled(String ruleId) {
        return !disabledRules.contains(ruleId);
    }
}

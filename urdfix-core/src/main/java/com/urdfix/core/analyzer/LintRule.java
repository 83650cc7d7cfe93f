package com.urdfix.core.analyzer;

import java.util.List;

/**
 * Interface for lint rules that inspect a parsed robot description.
 *
 * <p>Rules are discovered via Java Service Provider Interface (SPI) and executed by
 * {@link UrdfAnalyzer} in priority order (lower numbers first). A rule only reads the
 * document; findings are returned as {@link UrdfIssue} data and never thrown.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.urdfix.core.analyzer.LintRule}
 *
 * @see LintContext
 * @see UrdfIssue
 */
public interface LintRule {

    /**
     * Returns unique identifier for this rule.
     *
     * <p>Used to disable the rule in configuration. Should be kebab-case
     * (e.g., "naming-conventions", "joint-limits").
     *
     * @return unique rule identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this rule.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns execution priority for this rule. Lower values run first, and the issue
     * list keeps that order.
     *
     * @return priority value (lower = earlier execution)
     */
    int getPriority();

    /**
     * Inspects the document and returns findings.
     *
     * @param context document and its kinematic graph
     * @return issues found, empty if none
     */
    List<UrdfIssue> check(LintContext context);
}

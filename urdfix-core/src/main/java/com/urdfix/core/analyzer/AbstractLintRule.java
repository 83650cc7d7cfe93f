package com.urdfix.core.analyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for lint rules.
 *
 * <p>Provides one logger per concrete rule class and helpers that create issues for
 * the rule's category, so implementations only decide what to flag.
 *
 * @see LintRule
 */
public abstract class AbstractLintRule implements LintRule {

    /**
     * Logger instance for this rule.
     * Automatically initialized with the concrete rule class name.
     */
    protected final Logger log;

    protected AbstractLintRule() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Returns the category of the issues this rule reports.
     *
     * @return issue category
     */
    protected abstract IssueCategory category();

    protected UrdfIssue error(String message, String elementName, String suggestion) {
        return UrdfIssue.error(category(), message, elementName, suggestion);
    }

    protected UrdfIssue warning(String message, String elementName, String suggestion) {
        return UrdfIssue.warning(category(), message, elementName, suggestion);
    }

    protected UrdfIssue info(String message, String elementName, String suggestion) {
        return UrdfIssue.info(category(), message, elementName, suggestion);
    }
}

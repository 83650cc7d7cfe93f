package com.urdfix.core.analyzer;

import java.util.Objects;

/**
 * A finding reported by a lint rule.
 *
 * <p>Issues are data: a document with any number of issues is still a successfully
 * parsed document.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * UrdfIssue issue = UrdfIssue.warning(
 *     IssueCategory.PHYSICS,
 *     "Joint 'elbow' of type 'revolute' is missing limit specification",
 *     "elbow",
 *     "Add a <limit> element"
 * );
 * }</pre>
 *
 * @param severity severity level
 * @param category affected area
 * @param message human-readable description
 * @param elementName name of the offending element, optional
 * @param suggestion suggested remedy, optional
 */
public record UrdfIssue(
    IssueSeverity severity,
    IssueCategory category,
    String message,
    String elementName,
    String suggestion
) {
    /**
     * Compact constructor with validation.
     */
    public UrdfIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Create an error issue.
     *
     * @param category affected area
     * @param message the message
     * @param elementName offending element, may be null
     * @param suggestion remedy, may be null
     * @return a new issue with ERROR severity
     */
    public static UrdfIssue error(IssueCategory category, String message, String elementName, String suggestion) {
        return new UrdfIssue(IssueSeverity.ERROR, category, message, elementName, suggestion);
    }

    /**
     * Create a warning issue.
     *
     * @param category affected area
     * @param message the message
     * @param elementName offending element, may be null
     * @param suggestion remedy, may be null
     * @return a new issue with WARNING severity
     */
    public static UrdfIssue warning(IssueCategory category, String message, String elementName, String suggestion) {
        return new UrdfIssue(IssueSeverity.WARNING, category, message, elementName, suggestion);
    }

    /**
     * Create an informational issue.
     *
     * @param category affected area
     * @param message the message
     * @param elementName offending element, may be null
     * @param suggestion remedy, may be null
     * @return a new issue with INFO severity
     */
    public static UrdfIssue info(IssueCategory category, String message, String elementName, String suggestion) {
        return new UrdfIssue(IssueSeverity.INFO, category, message, elementName, suggestion);
    }
}

package com.urdfix.core.analyzer;

/**
 * Severity level of a lint finding.
 */
public enum IssueSeverity {
    /**
     * Error - the description is structurally broken or inconsistent.
     */
    ERROR,

    /**
     * Warning - likely mistake that tools may tolerate.
     */
    WARNING,

    /**
     * Informational - cleanup opportunity, no action required.
     */
    INFO
}

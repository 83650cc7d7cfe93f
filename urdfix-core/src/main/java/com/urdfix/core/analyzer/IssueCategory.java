package com.urdfix.core.analyzer;

/**
 * Area of the robot description a lint finding belongs to.
 */
public enum IssueCategory {
    STRUCTURE,
    NAMING,
    PHYSICS,
    GEOMETRY,
    VALIDATION,
    STYLE
}

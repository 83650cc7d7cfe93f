package com.urdfix.core;

import java.util.Objects;

/**
 * Runtime exception for failed parse, validation and regeneration operations.
 *
 * <p>Lint findings are never reported through this exception, they are returned as data.
 * Callers map {@link #kind()} to their own failure handling.
 */
public class UrdfException extends RuntimeException {

    /**
     * Failure categories.
     */
    public enum ErrorKind {
        /** Malformed or unbalanced markup. */
        SYNTAX,
        /** Input could not be read. */
        IO,
        /** A recognized element lacks a required attribute. */
        MISSING_ATTRIBUTE,
        /** Structurally invalid content: no robot, bad number list, broken kinematic tree. */
        STRUCTURE,
        /** Model content that cannot be serialized. */
        ENCODING
    }

    private final ErrorKind kind;

    public UrdfException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public UrdfException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind kind() {
        return kind;
    }

    public static UrdfException syntax(String message, Throwable cause) {
        return new UrdfException(ErrorKind.SYNTAX, message, cause);
    }

    public static UrdfException io(String message, Throwable cause) {
        return new UrdfException(ErrorKind.IO, message, cause);
    }

    public static UrdfException missingAttribute(String element, String attribute) {
        return new UrdfException(ErrorKind.MISSING_ATTRIBUTE,
            "Missing required attribute '" + attribute + "' on <" + element + ">");
    }

    public static UrdfException structure(String message) {
        return new UrdfException(ErrorKind.STRUCTURE, message);
    }

    public static UrdfException encoding(String message) {
        return new UrdfException(ErrorKind.ENCODING, message);
    }

    public static UrdfException encoding(String message, Throwable cause) {
        return new UrdfException(ErrorKind.ENCODING, message, cause);
    }
}

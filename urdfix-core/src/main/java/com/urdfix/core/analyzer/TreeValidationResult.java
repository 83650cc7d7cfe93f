package com.urdfix.core.analyzer;

import java.util.List;

/**
 * Outcome of kinematic-tree validation.
 *
 * @param valid true if the joints form a single tree over all links
 * @param errors human-readable violations, empty when valid
 */
public record TreeValidationResult(
    boolean valid,
    List<String> errors
) {
    public TreeValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static TreeValidationResult ok() {
        return new TreeValidationResult(true, List.of());
    }

    public static TreeValidationResult invalid(List<String> errors) {
        return new TreeValidationResult(false, errors);
    }
}

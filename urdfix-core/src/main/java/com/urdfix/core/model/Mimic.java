package com.urdfix.core.model;

import java.util.Objects;

/**
 * Makes a joint follow another joint: {@code value = multiplier * other + offset}.
 *
 * @param joint name of the mimicked joint (a name reference, not ownership)
 * @param multiplier optional multiplier
 * @param offset optional offset
 */
public record Mimic(
    String joint,
    Double multiplier,
    Double offset
) {
    /**
     * Compact constructor with validation.
     */
    public Mimic {
        Objects.requireNonNull(joint, "joint must not be null");
    }

    /**
     * Returns a copy referencing another joint.
     *
     * @param newJoint name of the mimicked joint
     * @return updated mimic
     */
    public Mimic withJoint(String newJoint) {
        return new Mimic(newJoint, multiplier, offset);
    }
}

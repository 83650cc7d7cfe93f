package com.urdfix.core.model;

/**
 * Pose of an element relative to its parent frame.
 *
 * @param xyz translation (defaults to the zero vector)
 * @param rpy roll/pitch/yaw rotation in radians (defaults to the zero vector)
 */
public record Origin(
    Vector3 xyz,
    Vector3 rpy
) {
    /**
     * Compact constructor with defaults.
     */
    public Origin {
        if (xyz == null) {
            xyz = Vector3.ZERO;
        }
        if (rpy == null) {
            rpy = Vector3.ZERO;
        }
    }
}

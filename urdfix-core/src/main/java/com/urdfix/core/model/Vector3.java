package com.urdfix.core.model;

/**
 * Three-component vector used for positions, rotations, axes and sizes.
 *
 * @param x first component
 * @param y second component
 * @param z third component
 */
public record Vector3(
    double x,
    double y,
    double z
) {
    /** The zero vector, default for absent {@code xyz} and {@code rpy}. */
    public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);

    /** The x unit vector, default for an absent joint axis. */
    public static final Vector3 UNIT_X = new Vector3(1.0, 0.0, 0.0);

    /**
     * Creates a vector from its components.
     *
     * @param x first component
     * @param y second component
     * @param z third component
     * @return new vector
     */
    public static Vector3 of(double x, double y, double z) {
        return new Vector3(x, y, z);
    }
}

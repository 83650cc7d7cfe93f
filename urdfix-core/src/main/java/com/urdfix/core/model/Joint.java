package com.urdfix.core.model;

import java.util.Objects;

/**
 * Directed connection from a parent link to a child link.
 *
 * <p>{@code parent} and {@code child} are name references into {@link Robot#links()},
 * their validity is only established by cross-checking against that collection.
 *
 * @param name unique joint name
 * @param type joint type tag (free-form, see the constants)
 * @param parent parent link name
 * @param child child link name
 * @param origin transform from parent to joint frame, optional
 * @param axis joint axis, optional
 * @param limit joint limits, optional
 * @param dynamics joint dynamics, optional
 * @param mimic mimic relation, optional
 */
public record Joint(
    String name,
    String type,
    String parent,
    String child,
    Origin origin,
    Axis axis,
    Limit limit,
    Dynamics dynamics,
    Mimic mimic
) {
    public static final String REVOLUTE = "revolute";
    public static final String CONTINUOUS = "continuous";
    public static final String PRISMATIC = "prismatic";
    public static final String FIXED = "fixed";
    public static final String FLOATING = "floating";
    public static final String PLANAR = "planar";

    /**
     * Compact constructor with validation.
     */
    public Joint {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(child, "child must not be null");
    }

    /**
     * Creates a joint with only the mandatory fields.
     *
     * @param name joint name
     * @param type joint type
     * @param parent parent link name
     * @param child child link name
     * @return new joint
     */
    public static Joint of(String name, String type, String parent, String child) {
        return new Joint(name, type, parent, child, null, null, null, null, null);
    }

    /**
     * Returns true for joint types that are expected to declare a limit element.
     *
     * @return true for revolute and prismatic joints
     */
    public boolean requiresLimit() {
        return REVOLUTE.equals(type) || PRISMATIC.equals(type);
    }

    public Joint withName(String newName) {
        return new Joint(newName, type, parent, child, origin, axis, limit, dynamics, mimic);
    }

    public Joint withParent(String newParent) {
        return new Joint(name, type, newParent, child, origin, axis, limit, dynamics, mimic);
    }

    public Joint withChild(String newChild) {
        return new Joint(name, type, parent, newChild, origin, axis, limit, dynamics, mimic);
    }

    public Joint withLimit(Limit newLimit) {
        return new Joint(name, type, parent, child, origin, axis, newLimit, dynamics, mimic);
    }

    public Joint withMimic(Mimic newMimic) {
        return new Joint(name, type, parent, child, origin, axis, limit, dynamics, newMimic);
    }
}

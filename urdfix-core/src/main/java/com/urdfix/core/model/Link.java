package com.urdfix.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Rigid body of the robot.
 *
 * @param name unique link name
 * @param inertial mass properties, optional
 * @param visuals visual elements in document order
 * @param collisions collision elements in document order
 */
public record Link(
    String name,
    Inertial inertial,
    List<Visual> visuals,
    List<Collision> collisions
) {
    /**
     * Compact constructor with validation.
     */
    public Link {
        Objects.requireNonNull(name, "name must not be null");
        visuals = visuals == null ? List.of() : List.copyOf(visuals);
        collisions = collisions == null ? List.of() : List.copyOf(collisions);
    }

    /**
     * Creates a link with no content.
     *
     * @param name link name
     * @return empty link
     */
    public static Link empty(String name) {
        return new Link(name, null, List.of(), List.of());
    }

    /**
     * Returns true if the link carries visual or collision geometry.
     *
     * @return true if any visual or collision element is present
     */
    public boolean hasGeometry() {
        return !visuals.isEmpty() || !collisions.isEmpty();
    }

    /**
     * Returns true if the link has no inertial, visual or collision element.
     *
     * @return true for an empty link
     */
    public boolean isEmpty() {
        return inertial == null && visuals.isEmpty() && collisions.isEmpty();
    }

    public Link withName(String newName) {
        return new Link(newName, inertial, visuals, collisions);
    }

    public Link withInertial(Inertial newInertial) {
        return new Link(name, newInertial, visuals, collisions);
    }

    public Link withVisuals(List<Visual> newVisuals) {
        return new Link(name, inertial, newVisuals, collisions);
    }
}

package com.urdfix.core.model;

import java.util.Objects;

/**
 * Named material shared by visuals.
 *
 * @param name unique material name
 * @param color optional color
 * @param texture optional texture
 */
public record Material(
    String name,
    Color color,
    Texture texture
) {
    public Material {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Material named(String name) {
        return new Material(name, null, null);
    }

    public Material withName(String newName) {
        return new Material(newName, color, texture);
    }
}

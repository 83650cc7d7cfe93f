package com.urdfix.core.model;

import java.util.Objects;

/**
 * Reference from a visual to a material by name.
 *
 * @param name referenced material name
 */
public record MaterialRef(String name) {

    public MaterialRef {
        Objects.requireNonNull(name, "name must not be null");
    }
}

package com.urdfix.core.model;

import java.util.Objects;

/**
 * Texture image reference. The file is never resolved.
 *
 * @param filename texture resource reference
 */
public record Texture(String filename) {

    public Texture {
        Objects.requireNonNull(filename, "filename must not be null");
    }
}

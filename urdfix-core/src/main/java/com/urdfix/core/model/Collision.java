package com.urdfix.core.model;

/**
 * Collision shape of a link.
 *
 * @param name optional element name
 * @param origin pose relative to the link frame, optional
 * @param geometry shape, optional
 */
public record Collision(
    String name,
    Origin origin,
    Geometry geometry
) {
}

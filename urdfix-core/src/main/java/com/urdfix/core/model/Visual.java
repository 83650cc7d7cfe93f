package com.urdfix.core.model;

/**
 * Visual representation of a link.
 *
 * @param name optional element name
 * @param origin pose relative to the link frame, optional
 * @param geometry shape, optional
 * @param material material reference, optional
 */
public record Visual(
    String name,
    Origin origin,
    Geometry geometry,
    MaterialRef material
) {
    /**
     * Returns a copy with another material reference.
     *
     * @param newMaterial material reference
     * @return updated visual
     */
    public Visual withMaterial(MaterialRef newMaterial) {
        return new Visual(name, origin, geometry, newMaterial);
    }
}

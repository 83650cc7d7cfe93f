package com.urdfix.core.model;

/**
 * Mass properties of a link.
 *
 * @param mass mass in kilograms
 * @param origin center of mass pose, optional
 * @param inertia inertia tensor, optional
 */
public record Inertial(
    double mass,
    Origin origin,
    Inertia inertia
) {
}

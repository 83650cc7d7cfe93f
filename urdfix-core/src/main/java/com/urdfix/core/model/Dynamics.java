package com.urdfix.core.model;

/**
 * Joint dynamics.
 *
 * @param damping damping coefficient, optional
 * @param friction static friction, optional
 */
public record Dynamics(
    Double damping,
    Double friction
) {
}

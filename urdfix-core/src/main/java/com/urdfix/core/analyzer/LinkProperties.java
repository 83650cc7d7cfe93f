package com.urdfix.core.analyzer;

/**
 * How many links carry each kind of content.
 *
 * @param withVisual links with at least one visual
 * @param withCollision links with at least one collision
 * @param withInertial links with an inertial block
 * @param empty links with none of the three
 */
public record LinkProperties(
    int withVisual,
    int withCollision,
    int withInertial,
    int empty
) {
}

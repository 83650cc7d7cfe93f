package com.urdfix.core.model;

/**
 * Joint axis expressed in the joint frame.
 *
 * @param xyz axis direction (defaults to the x unit vector)
 */
public record Axis(Vector3 xyz) {

    public Axis {
        if (xyz == null) {
            xyz = Vector3.UNIT_X;
        }
    }
}

package com.urdfix.core.model;

import java.util.Objects;

/**
 * Shape of a visual or collision element.
 *
 * <p>The variants are closed: {@link Box}, {@link Cylinder}, {@link Sphere} and {@link Mesh}.
 * Mesh files are kept as references only, they are never loaded.
 */
public interface Geometry {

    /**
     * Returns the element name used for this shape in URDF ({@code box}, {@code mesh}, ...).
     *
     * @return shape tag
     */
    String shapeName();

    /**
     * Axis-aligned box.
     *
     * @param size edge lengths
     */
    record Box(Vector3 size) implements Geometry {
        public Box {
            Objects.requireNonNull(size, "size must not be null");
        }

        @Override
        public String shapeName() {
            return "box";
        }
    }

    /**
     * Cylinder along the z axis.
     *
     * @param radius radius
     * @param length length
     */
    record Cylinder(double radius, double length) implements Geometry {
        @Override
        public String shapeName() {
            return "cylinder";
        }
    }

    /**
     * Sphere.
     *
     * @param radius radius
     */
    record Sphere(double radius) implements Geometry {
        @Override
        public String shapeName() {
            return "sphere";
        }
    }

    /**
     * Triangle mesh stored in an external file.
     *
     * @param filename mesh resource reference
     * @param scale optional per-axis scale
     */
    record Mesh(String filename, Vector3 scale) implements Geometry {
        public Mesh {
            Objects.requireNonNull(filename, "filename must not be null");
        }

        @Override
        public String shapeName() {
            return "mesh";
        }
    }
}

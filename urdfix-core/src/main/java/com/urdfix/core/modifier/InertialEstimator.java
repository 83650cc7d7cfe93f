package com.urdfix.core.modifier;

import java.util.ArrayList;
import java.util.List;

import com.urdfix.core.model.Collision;
import com.urdfix.core.model.Geometry;
import com.urdfix.core.model.Inertia;
import com.urdfix.core.model.Inertial;
import com.urdfix.core.model.Link;
import com.urdfix.core.model.Origin;
import com.urdfix.core.model.Visual;

/**
 * Synthesizes placeholder inertial blocks for links that have geometry but no mass.
 *
 * <p>The estimate treats the first primitive shape of the link (visuals before
 * collisions) as a solid body of {@value #DEFAULT_MASS} kg. Links with only meshes or
 * degenerate shapes get a small uniform diagonal tensor.
 */
final class InertialEstimator {

    static final double DEFAULT_MASS = 1.0;
    static final double FALLBACK_INERTIA = 0.001;

    private InertialEstimator() {
        // Utility class
    }

    static Inertial estimate(Link link) {
        List<Geometry> shapes = new ArrayList<>();
        link.visuals().stream().map(Visual::geometry).forEach(shapes::add);
        link.collisions().stream().map(Collision::geometry).forEach(shapes::add);

        Inertia inertia = null;
        for (Geometry shape : shapes) {
            inertia = solidInertia(shape, DEFAULT_MASS);
            if (inertia != null) {
                break;
            }
        }
        if (inertia == null) {
            inertia = Inertia.diagonal(FALLBACK_INERTIA, FALLBACK_INERTIA, FALLBACK_INERTIA);
        }
        return new Inertial(DEFAULT_MASS, new Origin(null, null), inertia);
    }

    /**
     * Returns the inertia of a solid primitive about its center, or null for meshes and
     * shapes whose tensor would not be positive.
     */
    private static Inertia solidInertia(Geometry shape, double m) {
        Inertia inertia = null;
        if (shape instanceof Geometry.Box box) {
            double x2 = box.size().x() * box.size().x();
            double y2 = box.size().y() * box.size().y();
            double z2 = box.size().z() * box.size().z();
            inertia = Inertia.diagonal(m / 12 * (y2 + z2), m / 12 * (x2 + z2), m / 12 * (x2 + y2));
        } else if (shape instanceof Geometry.Cylinder cylinder) {
            double r2 = cylinder.radius() * cylinder.radius();
            double l2 = cylinder.length() * cylinder.length();
            double side = m / 12 * (3 * r2 + l2);
            inertia = Inertia.diagonal(side, side, m * r2 / 2);
        } else if (shape instanceof Geometry.Sphere sphere) {
            double i = 2.0 / 5.0 * m * sphere.radius() * sphere.radius();
            inertia = Inertia.diagonal(i, i, i);
        }
        if (inertia == null || !(inertia.ixx() > 0 && inertia.iyy() > 0 && inertia.izz() > 0)) {
            return null;
        }
        return inertia;
    }
}

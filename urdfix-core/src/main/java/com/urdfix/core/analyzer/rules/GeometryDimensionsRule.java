package com.urdfix.core.analyzer.rules;

import java.util.ArrayList;
import java.util.List;

import com.urdfix.core.analyzer.AbstractLintRule;
import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.LintContext;
import com.urdfix.core.analyzer.UrdfIssue;
import com.urdfix.core.model.Collision;
import com.urdfix.core.model.Geometry;
import com.urdfix.core.model.Link;
import com.urdfix.core.model.Visual;

/**
 * Flags primitive shapes with non-positive dimensions and meshes without a filename.
 */
public class GeometryDimensionsRule extends AbstractLintRule {

    @Override
    public String getId() {
        return "geometry-dimensions";
    }

    @Override
    public String getDisplayName() {
        return "Geometry Dimensions";
    }

    @Override
    public int getPriority() {
        return 35;
    }

    @Override
    protected IssueCategory category() {
        return IssueCategory.GEOMETRY;
    }

    @Override
    public List<UrdfIssue> check(LintContext context) {
        List<UrdfIssue> issues = new ArrayList<>();
        for (Link link : context.robot().links().values()) {
            for (Visual visual : link.visuals()) {
                checkGeometry(link.name(), "visual", visual.geometry(), issues);
            }
            for (Collision collision : link.collisions()) {
                checkGeometry(link.name(), "collision", collision.geometry(), issues);
            }
        }
        return issues;
    }

    private void checkGeometry(String link, String role, Geometry geometry, List<UrdfIssue> issues) {
        String problem = problemOf(geometry);
        if (problem != null) {
            issues.add(warning(
                "Link '" + link + "' has a " + role + " " + geometry.shapeName() + " with " + problem,
                link,
                "Use strictly positive dimensions"));
        }
    }

    private static String problemOf(Geometry geometry) {
        if (geometry instanceof Geometry.Box box) {
            boolean positive = box.size().x() > 0 && box.size().y() > 0 && box.size().z() > 0;
            return positive ? null : "non-positive size";
        }
        if (geometry instanceof Geometry.Cylinder cylinder) {
            return cylinder.radius() > 0 && cylinder.length() > 0 ? null : "non-positive radius or length";
        }
        if (geometry instanceof Geometry.Sphere sphere) {
            return sphere.radius() > 0 ? null : "non-positive radius";
        }
        if (geometry instanceof Geometry.Mesh mesh) {
            return mesh.filename().isBlank() ? "an empty filename" : null;
        }
        return null;
    }
}

package com.urdfix.core.analyzer.rules;

import java.util.ArrayList;
import java.util.List;

import com.urdfix.core.analyzer.AbstractLintRule;
import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.LintContext;
import com.urdfix.core.analyzer.UrdfIssue;
import com.urdfix.core.model.Link;

/**
 * Flags links with visual or collision geometry but no inertial block. Simulators
 * drop or misbehave on such bodies.
 */
public class InertialPropertiesRule extends AbstractLintRule {

    @Override
    public String getId() {
        return "inertial-properties";
    }

    @Override
    public String getDisplayName() {
        return "Inertial Properties";
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    protected IssueCategory category() {
        return IssueCategory.PHYSICS;
    }

    @Override
    public List<UrdfIssue> check(LintContext context) {
        List<UrdfIssue> issues = new ArrayList<>();
        for (Link link : context.robot().links().values()) {
            if (link.hasGeometry() && link.inertial() == null) {
                issues.add(warning(
                    "Link '" + link.name() + "' has geometry but no inertial properties",
                    link.name(),
                    "Add an <inertial> block with mass and inertia"));
            }
        }
        return issues;
    }
}

package com.urdfix.core.analyzer.rules;

import java.util.ArrayList;
import java.util.List;

import com.urdfix.core.analyzer.AbstractLintRule;
import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.LintContext;
import com.urdfix.core.analyzer.UrdfIssue;
import com.urdfix.core.model.Joint;

/**
 * Flags revolute and prismatic joints without a limit element.
 */
public class JointLimitsRule extends AbstractLintRule {

    @Override
    public String getId() {
        return "joint-limits";
    }

    @Override
    public String getDisplayName() {
        return "Joint Limits";
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    protected IssueCategory category() {
        return IssueCategory.PHYSICS;
    }

    @Override
    public List<UrdfIssue> check(LintContext context) {
        List<UrdfIssue> issues = new ArrayList<>();
        for (Joint joint : context.robot().joints().values()) {
            if (joint.requiresLimit() && joint.limit() == null) {
                issues.add(warning(
                    "Joint '" + joint.name() + "' of type '" + joint.type() + "' is missing limit specification",
                    joint.name(),
                    "Add a <limit> element with lower, upper, effort and velocity"));
            }
        }
        return issues;
    }
}

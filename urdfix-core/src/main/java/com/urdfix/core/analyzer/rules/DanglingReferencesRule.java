package com.urdfix.core.analyzer.rules;

import java.util.ArrayList;
import java.util.List;

import com.urdfix.core.analyzer.AbstractLintRule;
import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.LintContext;
import com.urdfix.core.analyzer.UrdfIssue;
import com.urdfix.core.model.Joint;
import com.urdfix.core.model.Robot;

/**
 * Flags joints whose parent or child names no link and mimic relations naming no joint.
 */
public class DanglingReferencesRule extends AbstractLintRule {

    @Override
    public String getId() {
        return "dangling-references";
    }

    @Override
    public String getDisplayName() {
        return "Dangling References";
    }

    @Override
    public int getPriority() {
        return 45;
    }

    @Override
    protected IssueCategory category() {
        return IssueCategory.VALIDATION;
    }

    @Override
    public List<UrdfIssue> check(LintContext context) {
        Robot robot = context.robot();
        List<UrdfIssue> issues = new ArrayList<>();
        for (Joint joint : robot.joints().values()) {
            if (!robot.links().containsKey(joint.parent())) {
                issues.add(error(
                    "Joint '" + joint.name() + "' references missing parent link '" + joint.parent() + "'",
                    joint.name(),
                    "Define link '" + joint.parent() + "' or fix the reference"));
            }
            if (!robot.links().containsKey(joint.child())) {
                issues.add(error(
                    "Joint '" + joint.name() + "' references missing child link '" + joint.child() + "'",
                    joint.name(),
                    "Define link '" + joint.child() + "' or fix the reference"));
            }
            if (joint.mimic() != null && !robot.joints().containsKey(joint.mimic().joint())) {
                issues.add(error(
                    "Joint '" + joint.name() + "' mimics missing joint '" + joint.mimic().joint() + "'",
                    joint.name(),
                    "Point the mimic element at an existing joint"));
            }
        }
        return issues;
    }
}

package com.urdfix.core.analyzer.rules;

import java.util.List;

import com.urdfix.core.analyzer.AbstractLintRule;
import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.KinematicTreeValidator;
import com.urdfix.core.analyzer.LintContext;
import com.urdfix.core.analyzer.TreeValidationResult;
import com.urdfix.core.analyzer.UrdfIssue;

/**
 * Reports every kinematic-tree violation as a structure error.
 *
 * @see KinematicTreeValidator
 */
public class KinematicStructureRule extends AbstractLintRule {

    private final KinematicTreeValidator validator = new KinematicTreeValidator();

    @Override
    public String getId() {
        return "kinematic-structure";
    }

    @Override
    public String getDisplayName() {
        return "Kinematic Structure";
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    protected IssueCategory category() {
        return IssueCategory.STRUCTURE;
    }

    @Override
    public List<UrdfIssue> check(LintContext context) {
        TreeValidationResult result = validator.validate(context.robot(), context.graph());
        return result.errors().stream()
            .map(message -> error(message, null, "Fix kinematic tree structure"))
            .toList();
    }
}

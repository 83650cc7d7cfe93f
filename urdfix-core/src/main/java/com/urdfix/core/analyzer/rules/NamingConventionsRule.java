package com.urdfix.core.analyzer.rules;

import java.util.ArrayList;
import java.util.List;

import com.urdfix.core.analyzer.AbstractLintRule;
import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.LintContext;
import com.urdfix.core.analyzer.UrdfIssue;
import com.urdfix.core.util.NamingConventions;

/**
 * Flags link and joint names that are empty, contain characters other than ASCII
 * letters, digits and underscores, or start with a digit.
 */
public class NamingConventionsRule extends AbstractLintRule {

    private static final String SUGGESTION = "Use snake_case with descriptive names";

    @Override
    public String getId() {
        return "naming-conventions";
    }

    @Override
    public String getDisplayName() {
        return "Naming Conventions";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    protected IssueCategory category() {
        return IssueCategory.NAMING;
    }

    @Override
    public List<UrdfIssue> check(LintContext context) {
        List<UrdfIssue> issues = new ArrayList<>();
        for (String link : context.robot().links().keySet()) {
            if (!NamingConventions.isValidName(link)) {
                issues.add(warning("Link name '" + link + "' doesn't follow naming conventions", link, SUGGESTION));
            }
        }
        for (String joint : context.robot().joints().keySet()) {
            if (!NamingConventions.isValidName(joint)) {
                issues.add(warning("Joint name '" + joint + "' doesn't follow naming conventions", joint, SUGGESTION));
            }
        }
        return issues;
    }
}

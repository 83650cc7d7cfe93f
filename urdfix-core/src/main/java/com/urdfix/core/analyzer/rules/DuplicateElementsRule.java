package com.urdfix.core.analyzer.rules;

import java.util.ArrayList;
import java.util.List;

import com.urdfix.core.analyzer.AbstractLintRule;
import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.LintContext;
import com.urdfix.core.analyzer.UrdfIssue;
import com.urdfix.core.model.DuplicateReport;
import com.urdfix.core.model.ElementKind;

/**
 * Reports names that were defined more than once in the parsed text.
 *
 * <p>The robot only keeps the last definition of a name, so this rule reads the
 * {@link DuplicateReport} recorded by the parser.
 */
public class DuplicateElementsRule extends AbstractLintRule {

    @Override
    public String getId() {
        return "duplicate-elements";
    }

    @Override
    public String getDisplayName() {
        return "Duplicate Elements";
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    protected IssueCategory category() {
        return IssueCategory.VALIDATION;
    }

    @Override
    public List<UrdfIssue> check(LintContext context) {
        DuplicateReport report = context.document().duplicates();
        List<UrdfIssue> issues = new ArrayList<>();
        for (ElementKind kind : ElementKind.values()) {
            List<String> names = report.namesFor(kind);
            if (!names.isEmpty()) {
                issues.add(error(
                    "Duplicate " + kind.tag() + "s found: " + String.join(", ", names),
                    names.get(0),
                    "Remove or rename duplicate definitions, only the last one is kept"));
            }
        }
        return issues;
    }
}

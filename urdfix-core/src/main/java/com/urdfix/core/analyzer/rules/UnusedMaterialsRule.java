package com.urdfix.core.analyzer.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.urdfix.core.analyzer.AbstractLintRule;
import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.LintContext;
import com.urdfix.core.analyzer.UrdfIssue;
import com.urdfix.core.util.MaterialUsage;

/**
 * Reports materials that no visual references.
 */
public class UnusedMaterialsRule extends AbstractLintRule {

    @Override
    public String getId() {
        return "unused-materials";
    }

    @Override
    public String getDisplayName() {
        return "Unused Materials";
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    protected IssueCategory category() {
        return IssueCategory.STYLE;
    }

    @Override
    public List<UrdfIssue> check(LintContext context) {
        Set<String> referenced = MaterialUsage.referencedMaterials(context.robot());
        List<UrdfIssue> issues = new ArrayList<>();
        for (String material : context.robot().materials().keySet()) {
            if (!referenced.contains(material)) {
                issues.add(info(
                    "Unused material: '" + material + "'",
                    material,
                    "Remove unused material or add reference"));
            }
        }
        return issues;
    }
}

package com.urdfix.core.analyzer.rules;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.IssueSeverity;
import com.urdfix.core.analyzer.LintRule;
import com.urdfix.core.analyzer.UrdfIssue;

import static org.assertj.core.api.Assertions.assertThat;

class NamingConventionsRuleTest extends LintRuleTestBase {

    @Override
    protected LintRule rule() {
        return new NamingConventionsRule();
    }

    @Test
    void check_invalidLinkAndJointNames_warnsForEach() {
        List<UrdfIssue> issues = check("""
            <link name="base_link"/>
            <link name="2nd link"/>
            <joint name="joint-1" type="fixed"><parent link="base_link"/><child link="2nd link"/></joint>
            """);

        assertThat(issues).extracting(UrdfIssue::elementName).containsExactly("2nd link", "joint-1");
        assertThat(issues).allSatisfy(issue -> {
            assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
            assertThat(issue.category()).isEqualTo(IssueCategory.NAMING);
            assertThat(issue.suggestion()).isEqualTo("Use snake_case with descriptive names");
        });
        assertThat(issues.get(0).message()).isEqualTo("Link name '2nd link' doesn't follow naming conventions");
    }

    @Test
    void check_validNames_reportsNothing() {
        assertThat(check("<link name=\"_Base_Link2\"/>")).isEmpty();
    }
}

package com.urdfix.core.analyzer.rules;

import org.junit.jupiter.api.Test;

import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.IssueSeverity;
import com.urdfix.core.analyzer.LintRule;
import com.urdfix.core.analyzer.UrdfIssue;

import static org.assertj.core.api.Assertions.assertThat;

class KinematicStructureRuleTest extends LintRuleTestBase {

    @Override
    protected LintRule rule() {
        return new KinematicStructureRule();
    }

    @Test
    void check_eachValidationErrorBecomesStructureError() {
        assertThat(check("""
            <link name="a"/>
            <link name="b"/>
            """))
            .hasSize(2)
            .allSatisfy(issue -> {
                assertThat(issue.severity()).isEqualTo(IssueSeverity.ERROR);
                assertThat(issue.category()).isEqualTo(IssueCategory.STRUCTURE);
                assertThat(issue.suggestion()).isEqualTo("Fix kinematic tree structure");
            })
            .extracting(UrdfIssue::message)
            .containsExactly("Expected exactly 1 root link, found 2: a, b", "Found orphaned links: a, b");
    }

    @Test
    void check_singleLinkRobot_reportsNothing() {
        assertThat(check("<link name=\"base_link\"/>")).isEmpty();
    }
}

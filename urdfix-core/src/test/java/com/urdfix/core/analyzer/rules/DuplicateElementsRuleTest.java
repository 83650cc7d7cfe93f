package com.urdfix.core.analyzer.rules;

import org.junit.jupiter.api.Test;

import com.urdfix.core.analyzer.IssueCategory;
import com.urdfix.core.analyzer.IssueSeverity;
import com.urdfix.core.analyzer.LintRule;
import com.urdfix.core.analyzer.UrdfIssue;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateElementsRuleTest extends LintRuleTestBase {

    @Override
    protected LintRule rule() {
        return new DuplicateElementsRule();
    }

    @Test
    void check_namesDefinedTwice_reportsOneErrorPerKind() {
        assertThat(check("""
            <link name="a"/>
            <link name="a"/>
            <link name="b"/>
            <link name="b"/>
            <material name="m"/>
            <material name="m"/>
            """))
            .extracting(UrdfIssue::message)
            .containsExactly("Duplicate links found: a, b", "Duplicate materials found: m");
    }

    @Test
    void check_reportsValidationErrors() {
        assertThat(check("<link name=\"a\"/><link name=\"a\"/>"))
            .singleElement()
            .satisfies(issue -> {
                assertThat(issue.severity()).isEqualTo(IssueSeverity.ERROR);
                assertThat(issue.category()).isEqualTo(IssueCategory.VALIDATION);
            });
    }

    @Test
    void check_uniqueNames_reportsNothing() {
        assertThat(check(parseFixture("arm.urdf"))).isEmpty();
    }
}

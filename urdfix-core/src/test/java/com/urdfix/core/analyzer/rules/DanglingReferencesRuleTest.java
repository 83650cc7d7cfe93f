package com.urdfix.core.analyzer.rules;

import org.junit.jupiter.api.Test;

import com.urdfix.core.analyzer.LintRule;
import com.urdfix.core.analyzer.UrdfIssue;

import static org.assertj.core.api.Assertions.assertThat;

class DanglingReferencesRuleTest extends LintRuleTestBase {

    @Override
    protected LintRule rule() {
        return new DanglingReferencesRule();
    }

    @Test
    void check_missingLinksAndMimicTarget_reportsEach() {
        assertThat(check("""
            <link name="base"/>
            <joint name="j1" type="fixed"><parent link="base"/><child link="ghost"/></joint>
            <joint name="j2" type="revolute">
              <parent link="nowhere"/><child link="base"/>
              <mimic joint="missing_joint"/>
            </joint>
            """))
            .extracting(UrdfIssue::message)
            .containsExactly(
                "Joint 'j1' references missing child link 'ghost'",
                "Joint 'j2' references missing parent link 'nowhere'",
                "Joint 'j2' mimics missing joint 'missing_joint'");
    }

    @Test
    void check_fixture_reportsNothing() {
        assertThat(check(parseFixture("arm.urdf"))).isEmpty();
    }
}

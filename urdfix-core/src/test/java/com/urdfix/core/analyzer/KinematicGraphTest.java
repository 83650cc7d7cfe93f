package com.urdfix.core.analyzer;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.urdfix.core.model.Joint;
import com.urdfix.core.model.Link;
import com.urdfix.core.model.Robot;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KinematicGraph}.
 */
class KinematicGraphTest {

    private static Robot robot(List<String> links, Joint... joints) {
        Robot robot = Robot.named("test");
        links.forEach(name -> robot.putLink(Link.empty(name)));
        for (Joint joint : joints) {
            robot.putJoint(joint);
        }
        return robot;
    }

    private static Joint fixed(String name, String parent, String child) {
        return Joint.of(name, Joint.FIXED, parent, child);
    }

    @Test
    void rootsAndLeaves_branchingTree_followLinkOrder() {
        KinematicGraph graph = KinematicGraph.of(robot(
            List.of("base", "arm", "left", "right"),
            fixed("j1", "base", "arm"),
            fixed("j2", "arm", "left"),
            fixed("j3", "arm", "right")));

        assertThat(graph.roots()).containsExactly("base");
        assertThat(graph.leaves()).containsExactly("left", "right");
        assertThat(graph.orphans()).isEmpty();
        assertThat(graph.childrenByParent())
            .containsEntry("base", List.of("arm"))
            .containsEntry("arm", List.of("left", "right"));
    }

    @Test
    void depth_countsLinksOnLongestPath() {
        KinematicGraph graph = KinematicGraph.of(robot(
            List.of("base", "a", "b", "c"),
            fixed("j1", "base", "a"),
            fixed("j2", "a", "b"),
            fixed("j3", "base", "c")));

        assertThat(graph.depth()).isEqualTo(3);
    }

    @Test
    void depth_isolatedRootIsOne_noRootIsZero() {
        assertThat(KinematicGraph.of(robot(List.of("only"))).depth()).isEqualTo(1);
        assertThat(KinematicGraph.of(robot(List.of())).depth()).isZero();
    }

    @Test
    void chains_enumerateEveryRootToLeafPath() {
        KinematicGraph graph = KinematicGraph.of(robot(
            List.of("base", "arm", "left", "right"),
            fixed("j1", "base", "arm"),
            fixed("j2", "arm", "left"),
            fixed("j3", "arm", "right")));

        List<KinematicChain> chains = graph.chains();

        assertThat(chains).extracting(KinematicChain::name)
            .containsExactly("base_to_left", "base_to_right");
        assertThat(chains.get(0).links()).containsExactly("base", "arm", "left");
        assertThat(chains.get(0).joints()).containsExactly("j1", "j2");
        assertThat(chains.get(0).length()).isEqualTo(3);
    }

    @Test
    void chains_isolatedRoot_yieldsSingleLinkChain() {
        List<KinematicChain> chains = KinematicGraph.of(robot(List.of("only"))).chains();

        assertThat(chains).hasSize(1);
        assertThat(chains.get(0).name()).isEqualTo("only_to_only");
        assertThat(chains.get(0).length()).isEqualTo(1);
        assertThat(chains.get(0).joints()).isEmpty();
    }

    @Test
    void cycles_backEdge_reportsCyclePath() {
        KinematicGraph graph = KinematicGraph.of(robot(
            List.of("base", "a", "b"),
            fixed("j1", "base", "a"),
            fixed("j2", "a", "b"),
            fixed("j3", "b", "a")));

        assertThat(graph.cycles()).containsExactly(List.of("a", "b", "a"));
    }

    @Test
    void cycles_cycleWithoutRoot_isStillFound() {
        KinematicGraph graph = KinematicGraph.of(robot(
            List.of("a", "b"),
            fixed("j1", "a", "b"),
            fixed("j2", "b", "a")));

        assertThat(graph.roots()).isEmpty();
        assertThat(graph.cycles()).hasSize(1);
        assertThat(graph.depth()).isZero();
        assertThat(graph.chains()).isEmpty();
    }

    @Test
    void traversal_cycleBelowRoot_terminates() {
        KinematicGraph graph = KinematicGraph.of(robot(
            List.of("base", "a", "b", "tip"),
            fixed("j1", "base", "a"),
            fixed("j2", "a", "b"),
            fixed("j3", "b", "a"),
            fixed("j4", "b", "tip")));

        assertThat(graph.depth()).isEqualTo(4);
        assertThat(graph.chains()).extracting(KinematicChain::name).containsExactly("base_to_tip");
    }

    @Test
    void cycles_acyclicGraph_returnsEmpty() {
        KinematicGraph graph = KinematicGraph.of(robot(
            List.of("base", "a"),
            fixed("j1", "base", "a")));

        assertThat(graph.cycles()).isEmpty();
    }
}

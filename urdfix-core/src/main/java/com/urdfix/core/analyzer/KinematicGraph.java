package com.urdfix.core.analyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.urdfix.core.model.Joint;
import com.urdfix.core.model.Robot;

/**
 * Directed parent-to-child graph induced by the joints of a robot.
 *
 * <p>Links and joints only reference each other by name, so the graph is an adjacency
 * list keyed by link name with one edge per joint, in joint order. Names referenced by
 * a joint but not defined as a link still take part as nodes. Every traversal tracks
 * the nodes on the current path, so malformed graphs with cycles terminate.
 *
 * <p>Instances are immutable snapshots; they do not follow later edits of the robot.
 */
public final class KinematicGraph {

    /**
     * One joint seen as an edge.
     *
     * @param joint joint name
     * @param parent parent link name
     * @param child child link name
     */
    public record Edge(String joint, String parent, String child) {
        public Edge {
            Objects.requireNonNull(joint, "joint must not be null");
            Objects.requireNonNull(parent, "parent must not be null");
            Objects.requireNonNull(child, "child must not be null");
        }
    }

    private enum Color { WHITE, GREY, BLACK }

    private final List<String> links;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> adjacency;
    private final Set<String> nodes;
    private final Set<String> parents;
    private final Set<String> children;

    private KinematicGraph(List<String> links, List<Edge> edges) {
        this.links = List.copyOf(links);
        this.edges = List.copyOf(edges);
        this.adjacency = new LinkedHashMap<>();
        this.nodes = new LinkedHashSet<>(links);
        this.parents = new HashSet<>();
        this.children = new HashSet<>();
        for (Edge edge : this.edges) {
            adjacency.computeIfAbsent(edge.parent(), k -> new ArrayList<>()).add(edge);
            nodes.add(edge.parent());
            nodes.add(edge.child());
            parents.add(edge.parent());
            children.add(edge.child());
        }
    }

    /**
     * Builds the graph of a robot.
     *
     * @param robot robot to read
     * @return graph snapshot
     */
    public static KinematicGraph of(Robot robot) {
        List<Edge> edges = new ArrayList<>();
        for (Joint joint : robot.joints().values()) {
            edges.add(new Edge(joint.name(), joint.parent(), joint.child()));
        }
        return new KinematicGraph(new ArrayList<>(robot.links().keySet()), edges);
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * Returns the edges leaving a link.
     *
     * @param link parent link name
     * @return outgoing edges in joint order, empty if none
     */
    public List<Edge> outgoing(String link) {
        return Collections.unmodifiableList(adjacency.getOrDefault(link, List.of()));
    }

    /**
     * Returns the links never named as a joint child, in link order.
     *
     * @return root link names
     */
    public List<String> roots() {
        return links.stream().filter(link -> !children.contains(link)).toList();
    }

    /**
     * Returns the links never named as a joint parent, in link order.
     *
     * @return leaf link names
     */
    public List<String> leaves() {
        return links.stream().filter(link -> !parents.contains(link)).toList();
    }

    /**
     * Returns the links that appear in no joint at all, in link order.
     *
     * @return orphaned link names
     */
    public List<String> orphans() {
        return links.stream()
            .filter(link -> !parents.contains(link) && !children.contains(link))
            .toList();
    }

    /**
     * Returns each parent with the names of its children, in joint order.
     *
     * @return adjacency view by name
     */
    public Map<String, List<String>> childrenByParent() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        adjacency.forEach((parent, out) ->
            result.put(parent, out.stream().map(Edge::child).toList()));
        return Collections.unmodifiableMap(result);
    }

    // ==================== Depth and Chains ====================

    /**
     * Computes the tree depth: the longest simple downward path over all roots,
     * counted in links.
     *
     * @return depth, 1 for an isolated root, 0 without any root
     */
    public int depth() {
        int max = 0;
        for (String root : roots()) {
            max = Math.max(max, longestPath(root, new HashSet<>()));
        }
        return max;
    }

    private int longestPath(String node, Set<String> onPath) {
        onPath.add(node);
        int best = 0;
        for (Edge edge : outgoing(node)) {
            if (!onPath.contains(edge.child())) {
                best = Math.max(best, longestPath(edge.child(), onPath));
            }
        }
        onPath.remove(node);
        return best + 1;
    }

    /**
     * Enumerates every simple path from a root to a node without outgoing edges.
     *
     * <p>Parallel joints between the same links yield separate chains. On graphs where
     * branches reconnect the number of paths grows combinatorially.
     *
     * @return chains in root order, then joint order
     */
    public List<KinematicChain> chains() {
        List<KinematicChain> chains = new ArrayList<>();
        for (String root : roots()) {
            Deque<String> linkPath = new ArrayDeque<>();
            Deque<String> jointPath = new ArrayDeque<>();
            linkPath.addLast(root);
            collectChains(root, linkPath, jointPath, new HashSet<>(Set.of(root)), chains);
        }
        return chains;
    }

    private void collectChains(String node, Deque<String> linkPath, Deque<String> jointPath,
                               Set<String> onPath, List<KinematicChain> chains) {
        List<Edge> out = outgoing(node);
        if (out.isEmpty()) {
            chains.add(KinematicChain.of(new ArrayList<>(linkPath), new ArrayList<>(jointPath)));
            return;
        }
        for (Edge edge : out) {
            if (onPath.contains(edge.child())) {
                continue;
            }
            onPath.add(edge.child());
            linkPath.addLast(edge.child());
            jointPath.addLast(edge.joint());
            collectChains(edge.child(), linkPath, jointPath, onPath, chains);
            jointPath.removeLast();
            linkPath.removeLast();
            onPath.remove(edge.child());
        }
    }

    // ==================== Cycles ====================

    /**
     * Finds cycles with white/grey/black depth-first colouring started from every node.
     *
     * <p>Each back edge to a node on the current path yields one cycle, listed from the
     * re-entered node round to itself, e.g. {@code [a, b, c, a]}.
     *
     * @return cycles, empty for an acyclic graph
     */
    public List<List<String>> cycles() {
        Map<String, Color> colors = new HashMap<>();
        List<List<String>> cycles = new ArrayList<>();
        for (String node : nodes) {
            if (colors.getOrDefault(node, Color.WHITE) == Color.WHITE) {
                visit(node, colors, new ArrayList<>(), cycles);
            }
        }
        return cycles;
    }

    private void visit(String node, Map<String, Color> colors, List<String> path, List<List<String>> cycles) {
        colors.put(node, Color.GREY);
        path.add(node);
        for (Edge edge : outgoing(node)) {
            Color color = colors.getOrDefault(edge.child(), Color.WHITE);
            if (color == Color.GREY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(edge.child()), path.size()));
                cycle.add(edge.child());
                cycles.add(List.copyOf(cycle));
            } else if (color == Color.WHITE) {
                visit(edge.child(), colors, path, cycles);
            }
        }
        path.remove(path.size() - 1);
        colors.put(node, Color.BLACK);
    }
}

package com.urdfix.core.analyzer;

import java.util.List;
import java.util.Objects;

/**
 * A simple path from a root link down to a leaf link.
 *
 * @param name {@code <root>_to_<leaf>}
 * @param links link names from root to leaf
 * @param joints joint names along the path, one fewer than links
 * @param length number of links on the path
 */
public record KinematicChain(
    String name,
    List<String> links,
    List<String> joints,
    int length
) {
    public KinematicChain {
        Objects.requireNonNull(name, "name must not be null");
        links = links == null ? List.of() : List.copyOf(links);
        joints = joints == null ? List.of() : List.copyOf(joints);
    }

    /**
     * Creates a chain from its path.
     *
     * @param links link names from root to leaf
     * @param joints joint names along the path
     * @return chain named after its end points
     */
    public static KinematicChain of(List<String> links, List<String> joints) {
        String name = links.get(0) + "_to_" + links.get(links.size() - 1);
        return new KinematicChain(name, links, joints, links.size());
    }
}

package com.urdfix.core.analyzer;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Statistics derived from a robot description.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * UrdfStats stats = new UrdfAnalyzer().analyze(doc);
 * System.out.println(stats.getSummary());
 * // Robot 'arm': 4 links, 3 joints, 2 materials, depth 4, 1 chain(s)
 * }</pre>
 *
 * @param robotName robot name
 * @param linkCount number of links
 * @param jointCount number of joints
 * @param materialCount number of materials
 * @param jointTypes joint count per type, sorted by type
 * @param linkProperties link content coverage
 * @param treeDepth longest root-to-leaf path in links, 0 without a root
 * @param chains every simple root-to-leaf path
 */
public record UrdfStats(
    String robotName,
    int linkCount,
    int jointCount,
    int materialCount,
    Map<String, Integer> jointTypes,
    LinkProperties linkProperties,
    int treeDepth,
    List<KinematicChain> chains
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public UrdfStats {
        Objects.requireNonNull(robotName, "robotName must not be null");
        jointTypes = jointTypes == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(jointTypes));
        if (linkProperties == null) {
            linkProperties = new LinkProperties(0, 0, 0, 0);
        }
        chains = chains == null ? List.of() : List.copyOf(chains);
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Robot '%s': %d links, %d joints, %d materials, depth %d, %d chain(s)",
            robotName,
            linkCount,
            jointCount,
            materialCount,
            treeDepth,
            chains.size()
        );
    }
}

package com.urdfix.core.util;

import java.util.LinkedHashSet;
import java.util.Set;

import com.urdfix.core.model.Link;
import com.urdfix.core.model.Robot;
import com.urdfix.core.model.Visual;

/**
 * Lookups of material references held by visuals.
 */
public final class MaterialUsage {

    private MaterialUsage() {
        // Utility class
    }

    /**
     * Collects the names of all materials referenced by any visual.
     *
     * @param robot robot to scan
     * @return referenced material names in link order
     */
    public static Set<String> referencedMaterials(Robot robot) {
        Set<String> referenced = new LinkedHashSet<>();
        for (Link link : robot.links().values()) {
            for (Visual visual : link.visuals()) {
                if (visual.material() != null) {
                    referenced.add(visual.material().name());
                }
            }
        }
        return referenced;
    }
}

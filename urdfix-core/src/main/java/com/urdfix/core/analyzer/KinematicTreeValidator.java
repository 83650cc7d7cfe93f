package com.urdfix.core.analyzer;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.urdfix.core.model.Robot;

/**
 * Checks that the joints of a robot form a single kinematic tree.
 *
 * <p>Three checks run in order and all of them report:
 * <ol>
 *   <li>exactly one root link</li>
 *   <li>no cycle in the parent-to-child graph</li>
 *   <li>no link outside every joint, except for a robot made of one link and no joints</li>
 * </ol>
 */
public class KinematicTreeValidator {

    private static final Logger log = LoggerFactory.getLogger(KinematicTreeValidator.class);

    /**
     * Validates the kinematic tree of a robot.
     *
     * @param robot robot to check
     * @return result listing every violation
     */
    public TreeValidationResult validate(Robot robot) {
        return validate(robot, KinematicGraph.of(robot));
    }

    /**
     * Validates the kinematic tree using an already built graph of {@code robot}.
     *
     * @param robot robot to check
     * @param graph graph of the robot
     * @return result listing every violation
     */
    public TreeValidationResult validate(Robot robot, KinematicGraph graph) {
        List<String> errors = new ArrayList<>();

        List<String> roots = graph.roots();
        if (roots.size() != 1) {
            String message = "Expected exactly 1 root link, found " + roots.size();
            errors.add(roots.isEmpty() ? message : message + ": " + String.join(", ", roots));
        }

        for (List<String> cycle : graph.cycles()) {
            errors.add("Kinematic tree contains a cycle: " + String.join(" -> ", cycle));
        }

        boolean singleLinkRobot = robot.links().size() == 1 && robot.joints().isEmpty();
        List<String> orphans = graph.orphans();
        if (!singleLinkRobot && !orphans.isEmpty()) {
            errors.add("Found orphaned links: " + String.join(", ", orphans));
        }

        if (errors.isEmpty()) {
            log.debug("Kinematic tree of '{}' is valid", robot.name());
            return TreeValidationResult.ok();
        }
        log.debug("Kinematic tree of '{}' has {} error(s)", robot.name(), errors.size());
        return TreeValidationResult.invalid(errors);
    }
}

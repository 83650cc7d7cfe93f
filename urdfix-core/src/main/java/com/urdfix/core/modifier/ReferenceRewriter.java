package com.urdfix.core.modifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import com.urdfix.core.model.ElementKind;
import com.urdfix.core.model.GazeboElement;
import com.urdfix.core.model.Joint;
import com.urdfix.core.model.MaterialRef;
import com.urdfix.core.model.OpaqueElement;
import com.urdfix.core.model.Robot;
import com.urdfix.core.model.TransmissionElement;
import com.urdfix.core.model.Visual;

/**
 * Renames elements of a robot in place and rewrites every name reference to them.
 *
 * <p>References rewritten per kind:
 * <ul>
 *   <li><b>link:</b> joint parent and child, gazebo {@code reference}</li>
 *   <li><b>joint:</b> mimic targets, {@code <joint name>} inside transmissions, gazebo
 *       {@code reference} when no link carries the old name</li>
 *   <li><b>material:</b> visual material references</li>
 * </ul>
 * The renamed entry keeps its position in its collection.
 */
final class ReferenceRewriter {

    private static final String TRANSMISSION_JOINT = "joint";

    private ReferenceRewriter() {
        // Utility class
    }

    /**
     * Renames an element of the given robot.
     *
     * @return false if {@code oldName} is absent or {@code newName} is already taken
     */
    static boolean rename(Robot robot, ElementKind kind, String oldName, String newName) {
        Map<String, ?> elements = robot.elementsOf(kind);
        if (!elements.containsKey(oldName) || elements.containsKey(newName)) {
            return false;
        }
        switch (kind) {
            case LINK -> renameLink(robot, oldName, newName);
            case JOINT -> renameJoint(robot, oldName, newName);
            case MATERIAL -> renameMaterial(robot, oldName, newName);
        }
        return true;
    }

    private static void renameLink(Robot robot, String oldName, String newName) {
        renameKey(robot.links(), oldName, newName, link -> link.withName(newName));
        robot.joints().replaceAll((name, joint) -> {
            Joint updated = joint;
            if (oldName.equals(updated.parent())) {
                updated = updated.withParent(newName);
            }
            if (oldName.equals(updated.child())) {
                updated = updated.withChild(newName);
            }
            return updated;
        });
        rewriteGazeboReferences(robot, oldName, newName);
    }

    private static void renameJoint(Robot robot, String oldName, String newName) {
        renameKey(robot.joints(), oldName, newName, joint -> joint.withName(newName));
        robot.joints().replaceAll((name, joint) ->
            joint.mimic() != null && oldName.equals(joint.mimic().joint())
                ? joint.withMimic(joint.mimic().withJoint(newName))
                : joint);

        List<TransmissionElement> transmissions = robot.transmissionElements();
        transmissions.replaceAll(t -> t.withContent(rewriteJointRefs(t.content(), oldName, newName)));

        if (!robot.links().containsKey(oldName)) {
            rewriteGazeboReferences(robot, oldName, newName);
        }
    }

    private static void renameMaterial(Robot robot, String oldName, String newName) {
        renameKey(robot.materials(), oldName, newName, material -> material.withName(newName));
        robot.links().replaceAll((name, link) -> {
            List<Visual> visuals = new ArrayList<>();
            boolean changed = false;
            for (Visual visual : link.visuals()) {
                if (visual.material() != null && oldName.equals(visual.material().name())) {
                    visuals.add(visual.withMaterial(new MaterialRef(newName)));
                    changed = true;
                } else {
                    visuals.add(visual);
                }
            }
            return changed ? link.withVisuals(visuals) : link;
        });
    }

    private static void rewriteGazeboReferences(Robot robot, String oldName, String newName) {
        List<GazeboElement> gazebo = robot.gazeboElements();
        gazebo.replaceAll(g -> oldName.equals(g.reference()) ? g.withReference(newName) : g);
    }

    private static List<OpaqueElement> rewriteJointRefs(List<OpaqueElement> elements, String oldName, String newName) {
        List<OpaqueElement> result = new ArrayList<>(elements.size());
        for (OpaqueElement element : elements) {
            OpaqueElement updated = element;
            if (TRANSMISSION_JOINT.equals(element.name()) && oldName.equals(element.attributes().get("name"))) {
                updated = updated.withAttribute("name", newName);
            }
            if (!updated.children().isEmpty()) {
                updated = updated.withChildren(rewriteJointRefs(updated.children(), oldName, newName));
            }
            result.add(updated);
        }
        return result;
    }

    /**
     * Replaces a key of an insertion-ordered map without moving the entry.
     */
    private static <T> void renameKey(Map<String, T> map, String oldKey, String newKey, UnaryOperator<T> rename) {
        Map<String, T> rebuilt = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (key.equals(oldKey)) {
                rebuilt.put(newKey, rename.apply(value));
            } else {
                rebuilt.put(key, value);
            }
        });
        map.clear();
        map.putAll(rebuilt);
    }
}

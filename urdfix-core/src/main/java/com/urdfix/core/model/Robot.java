package com.urdfix.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level container of a robot description.
 *
 * <p>Links, joints and materials live in insertion-ordered maps keyed by name so that
 * regeneration is deterministic. Putting a name that is already present replaces the
 * previous entry and keeps its position. Unlike the other model records the collections
 * are mutable; a robot is owned by exactly one {@link UrdfDocument} and is edited through
 * {@link #copy()} followed by a swap.
 *
 * @param name robot name
 * @param links links by name
 * @param joints joints by name
 * @param materials materials by name
 * @param gazeboElements gazebo blocks in document order
 * @param transmissionElements transmission blocks in document order
 */
public record Robot(
    String name,
    Map<String, Link> links,
    Map<String, Joint> joints,
    Map<String, Material> materials,
    List<GazeboElement> gazeboElements,
    List<TransmissionElement> transmissionElements
) {
    /**
     * Compact constructor with validation. Collections are copied into mutable,
     * order-preserving containers.
     */
    public Robot {
        Objects.requireNonNull(name, "name must not be null");
        links = links == null ? new LinkedHashMap<>() : new LinkedHashMap<>(links);
        joints = joints == null ? new LinkedHashMap<>() : new LinkedHashMap<>(joints);
        materials = materials == null ? new LinkedHashMap<>() : new LinkedHashMap<>(materials);
        gazeboElements = gazeboElements == null ? new ArrayList<>() : new ArrayList<>(gazeboElements);
        transmissionElements = transmissionElements == null
            ? new ArrayList<>()
            : new ArrayList<>(transmissionElements);
    }

    /**
     * Creates a robot without any element.
     *
     * @param name robot name
     * @return empty robot
     */
    public static Robot named(String name) {
        return new Robot(name, null, null, null, null, null);
    }

    /**
     * Adds or replaces a link.
     *
     * @param link link to store under its name
     * @return the replaced link, or null
     */
    public Link putLink(Link link) {
        return links.put(link.name(), link);
    }

    /**
     * Adds or replaces a joint.
     *
     * @param joint joint to store under its name
     * @return the replaced joint, or null
     */
    public Joint putJoint(Joint joint) {
        return joints.put(joint.name(), joint);
    }

    /**
     * Adds or replaces a material.
     *
     * @param material material to store under its name
     * @return the replaced material, or null
     */
    public Material putMaterial(Material material) {
        return materials.put(material.name(), material);
    }

    /**
     * Returns the name-keyed collection for an element kind.
     *
     * @param kind element kind
     * @return live map of that kind
     */
    public Map<String, ?> elementsOf(ElementKind kind) {
        return switch (kind) {
            case LINK -> links;
            case JOINT -> joints;
            case MATERIAL -> materials;
        };
    }

    /**
     * Creates an independent copy. Element records are immutable and shared, only the
     * containers are duplicated.
     *
     * @return working copy of this robot
     */
    public Robot copy() {
        return new Robot(name, links, joints, materials, gazeboElements, transmissionElements);
    }
}

package com.urdfix.core.modifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.urdfix.core.UrdfException;
import com.urdfix.core.generator.FormatOptions;
import com.urdfix.core.generator.UrdfWriter;
import com.urdfix.core.model.DuplicateReport;
import com.urdfix.core.model.ElementKind;
import com.urdfix.core.model.Robot;
import com.urdfix.core.model.UrdfDocument;
import com.urdfix.core.util.MaterialUsage;
import com.urdfix.core.util.NamingConventions;

/**
 * Edits a {@link UrdfDocument} and regenerates its text.
 *
 * <p>Every operation works on a copy of the document's robot. The text is regenerated
 * from that copy, and the copy and text are committed to the document together only
 * after regeneration succeeded. A failing operation therefore leaves the document as it
 * was.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * UrdfModifier modifier = new UrdfModifier();
 * List<String> changes = modifier.fix(doc, FixOptions.defaults());
 * modifier.rename(doc, ElementKind.LINK, "base", "base_link");
 * Files.writeString(out, doc.text());
 * }</pre>
 */
public class UrdfModifier {

    private static final Logger log = LoggerFactory.getLogger(UrdfModifier.class);

    private final UrdfWriter writer;

    public UrdfModifier() {
        this(new UrdfWriter());
    }

    public UrdfModifier(UrdfWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    // ==================== Fix ====================

    /**
     * Applies the selected transforms with default formatting.
     *
     * @param doc document to edit
     * @param options selected transforms
     * @return change descriptions in application order, empty if nothing changed
     * @throws UrdfException ENCODING if the result cannot be written; the document is unchanged
     */
    public List<String> fix(UrdfDocument doc, FixOptions options) {
        return fix(doc, options, FormatOptions.defaults());
    }

    /**
     * Applies the selected transforms and regenerates the text with the given formatting.
     *
     * @param doc document to edit
     * @param options selected transforms
     * @param format formatting of the regenerated text
     * @return change descriptions in application order, empty if nothing changed
     * @throws UrdfException ENCODING if the result cannot be written; the document is unchanged
     */
    public List<String> fix(UrdfDocument doc, FixOptions options, FormatOptions format) {
        Objects.requireNonNull(doc, "doc must not be null");
        FixOptions effective = options == null ? FixOptions.defaults() : options;
        Robot working = doc.robot().copy();
        List<String> changes = new ArrayList<>();

        if (effective.removeDuplicates()) {
            changes.addAll(removeDuplicates(doc.duplicates()));
        }
        if (effective.removeUnusedMaterials()) {
            changes.addAll(removeUnusedMaterials(working));
        }
        if (effective.fixNaming()) {
            changes.addAll(fixNaming(working));
        }
        if (effective.addMissingProperties()) {
            changes.addAll(addMissingProperties(working));
        }
        if (effective.sortElements()) {
            changes.addAll(sortElements(working));
        }
        if (effective.cleanWhitespace()) {
            changes.add("Cleaned whitespace and formatting");
        }

        if (changes.isEmpty()) {
            log.info("No changes needed for robot '{}'", working.name());
            return changes;
        }

        commit(doc, working, format);
        if (effective.removeDuplicates()) {
            doc.clearDuplicates();
        }
        changes.forEach(change -> log.info("Applied: {}", change));
        return changes;
    }

    /**
     * The robot already holds the last definition of every name, so collapsing only
     * needs to report the names recorded at parse time.
     */
    private List<String> removeDuplicates(DuplicateReport duplicates) {
        List<String> changes = new ArrayList<>();
        for (ElementKind kind : ElementKind.values()) {
            for (String name : duplicates.namesFor(kind)) {
                changes.add("Removed duplicate " + kind.tag() + ": " + name);
            }
        }
        return changes;
    }

    private List<String> removeUnusedMaterials(Robot robot) {
        Set<String> referenced = MaterialUsage.referencedMaterials(robot);
        List<String> changes = new ArrayList<>();
        for (String material : new ArrayList<>(robot.materials().keySet())) {
            if (!referenced.contains(material)) {
                robot.materials().remove(material);
                changes.add("Removed unused material: " + material);
            }
        }
        return changes;
    }

    private List<String> fixNaming(Robot robot) {
        List<String> changes = new ArrayList<>();
        for (String name : new ArrayList<>(robot.links().keySet())) {
            if (!NamingConventions.isValidName(name)) {
                String fixed = uniqueName(NamingConventions.fixName(name), robot.links().keySet());
                ReferenceRewriter.rename(robot, ElementKind.LINK, name, fixed);
                changes.add("Fixed link name: " + name + " -> " + fixed);
            }
        }
        for (String name : new ArrayList<>(robot.joints().keySet())) {
            if (!NamingConventions.isValidName(name)) {
                String fixed = uniqueName(NamingConventions.fixName(name), robot.joints().keySet());
                ReferenceRewriter.rename(robot, ElementKind.JOINT, name, fixed);
                changes.add("Fixed joint name: " + name + " -> " + fixed);
            }
        }
        return changes;
    }

    private static String uniqueName(String candidate, Set<String> taken) {
        if (!taken.contains(candidate)) {
            return candidate;
        }
        int suffix = 2;
        while (taken.contains(candidate + "_" + suffix)) {
            suffix++;
        }
        return candidate + "_" + suffix;
    }

    private List<String> addMissingProperties(Robot robot) {
        List<String> changes = new ArrayList<>();
        robot.links().replaceAll((name, link) -> {
            if (link.hasGeometry() && link.inertial() == null) {
                changes.add("Added default inertial properties to link: " + name);
                return link.withInertial(InertialEstimator.estimate(link));
            }
            return link;
        });
        return changes;
    }

    private List<String> sortElements(Robot robot) {
        List<String> changes = new ArrayList<>();
        if (sortByName(robot.links())) {
            changes.add("Sorted links alphabetically");
        }
        if (sortByName(robot.joints())) {
            changes.add("Sorted joints alphabetically");
        }
        return changes;
    }

    private static <T> boolean sortByName(Map<String, T> elements) {
        List<String> before = new ArrayList<>(elements.keySet());
        Map<String, T> sorted = new LinkedHashMap<>(new TreeMap<>(elements));
        if (before.equals(new ArrayList<>(sorted.keySet()))) {
            return false;
        }
        elements.clear();
        elements.putAll(sorted);
        return true;
    }

    // ==================== Format ====================

    /**
     * Regenerates the document text from its model.
     *
     * @param doc document to format
     * @param options formatting settings
     * @return the regenerated text, also stored in the document
     * @throws UrdfException ENCODING if the model cannot be written; the document is unchanged
     */
    public String format(UrdfDocument doc, FormatOptions options) {
        Objects.requireNonNull(doc, "doc must not be null");
        commit(doc, doc.robot().copy(), options);
        log.info("Formatted robot '{}'", doc.robot().name());
        return doc.text();
    }

    // ==================== Point Edits ====================

    /**
     * Removes a link, joint or material. References to it are left in place.
     *
     * @param doc document to edit
     * @param kind element kind
     * @param name element name
     * @return true if the element existed and was removed
     * @throws UrdfException ENCODING if the result cannot be written; the document is unchanged
     */
    public boolean remove(UrdfDocument doc, ElementKind kind, String name) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Robot working = doc.robot().copy();
        if (working.elementsOf(kind).remove(name) == null) {
            log.debug("No {} named '{}' to remove", kind.tag(), name);
            return false;
        }
        commit(doc, working, FormatOptions.defaults());
        log.info("Removed {} '{}'", kind.tag(), name);
        return true;
    }

    /**
     * Renames a link, joint or material and rewrites every reference to it.
     *
     * @param doc document to edit
     * @param kind element kind
     * @param oldName current name
     * @param newName new name
     * @return false if {@code oldName} does not exist or {@code newName} is already taken
     * @throws UrdfException ENCODING if the result cannot be written; the document is unchanged
     */
    public boolean rename(UrdfDocument doc, ElementKind kind, String oldName, String newName) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(newName, "newName must not be null");
        Robot working = doc.robot().copy();
        if (!ReferenceRewriter.rename(working, kind, oldName, newName)) {
            log.debug("Cannot rename {} '{}' to '{}'", kind.tag(), oldName, newName);
            return false;
        }
        commit(doc, working, FormatOptions.defaults());
        log.info("Renamed {} '{}' to '{}'", kind.tag(), oldName, newName);
        return true;
    }

    // ==================== Commit ====================

    private void commit(UrdfDocument doc, Robot working, FormatOptions options) {
        String text = writer.write(working, options);
        doc.commit(working, text);
    }
}

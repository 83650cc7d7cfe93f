package com.urdfix.core.generator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.urdfix.core.UrdfException;
import com.urdfix.core.model.Collision;
import com.urdfix.core.model.GazeboElement;
import com.urdfix.core.model.Geometry;
import com.urdfix.core.model.Inertia;
import com.urdfix.core.model.Inertial;
import com.urdfix.core.model.Joint;
import com.urdfix.core.model.Limit;
import com.urdfix.core.model.Link;
import com.urdfix.core.model.Material;
import com.urdfix.core.model.Origin;
import com.urdfix.core.model.Robot;
import com.urdfix.core.model.TransmissionElement;
import com.urdfix.core.model.Vector3;
import com.urdfix.core.model.Visual;
import com.urdfix.core.util.NumberLists;

/**
 * Serializes a {@link Robot} to URDF text.
 *
 * <p>Output is always rebuilt from the model, never patched from earlier text, so the
 * same model and options produce the same text.
 *
 * <h2>Output Layout</h2>
 * <ul>
 *   <li><b>Sections:</b> materials, links, joints, gazebo blocks, transmission blocks,
 *       unless {@link FormatOptions#elementOrder()} says otherwise</li>
 *   <li><b>Elements:</b> one per line, nested by {@link FormatOptions#indent()};
 *       elements without content self-close when compaction is on</li>
 *   <li><b>Numbers:</b> shortest exact decimal form, triples space-joined</li>
 * </ul>
 *
 * <p>Characters that XML 1.0 cannot carry (control characters, lone surrogates) and
 * non-finite numbers fail with {@link UrdfException.ErrorKind#ENCODING}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * String text = new UrdfWriter().write(robot, FormatOptions.defaults());
 * }</pre>
 */
public class UrdfWriter {

    private static final Logger log = LoggerFactory.getLogger(UrdfWriter.class);

    private static final String XML_DECLARATION = "<?xml version=\"1.0\"?>";
    private static final String SECTION_MATERIAL = "material";
    private static final String SECTION_LINK = "link";
    private static final String SECTION_JOINT = "joint";
    private static final String SECTION_GAZEBO = "gazebo";
    private static final String SECTION_TRANSMISSION = "transmission";

    /**
     * Writes a robot as URDF text.
     *
     * @param robot robot to serialize
     * @param options formatting settings
     * @return URDF text ending with a newline
     * @throws UrdfException ENCODING if a name, attribute or number cannot be written
     */
    public String write(Robot robot, FormatOptions options) {
        Objects.requireNonNull(robot, "robot must not be null");
        FormatOptions effective = options == null ? FormatOptions.defaults() : options;

        XmlNode root = new XmlNode("robot").attr("name", robot.name());
        for (String section : sectionOrder(effective.elementOrder())) {
            appendSection(root, section, robot);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(XML_DECLARATION).append('\n');
        render(root, 0, effective, sb);

        String text = sb.toString();
        checkLineLengths(text, effective.maxLineLength());
        log.debug("Generated {} characters for robot '{}'", text.length(), robot.name());
        return text;
    }

    // ==================== Sections ====================

    private static Set<String> sectionOrder(List<String> hint) {
        Set<String> order = new LinkedHashSet<>();
        for (String section : hint) {
            if (FormatOptions.DEFAULT_ELEMENT_ORDER.contains(section)) {
                order.add(section);
            } else {
                log.debug("Ignoring unknown section '{}' in element order", section);
            }
        }
        order.addAll(FormatOptions.DEFAULT_ELEMENT_ORDER);
        return order;
    }

    private void appendSection(XmlNode root, String section, Robot robot) {
        switch (section) {
            case SECTION_MATERIAL -> robot.materials().values().forEach(m -> root.add(materialNode(m)));
            case SECTION_LINK -> robot.links().values().forEach(l -> root.add(linkNode(l)));
            case SECTION_JOINT -> robot.joints().values().forEach(j -> root.add(jointNode(j)));
            case SECTION_GAZEBO -> robot.gazeboElements().forEach(g -> root.add(gazeboNode(g)));
            case SECTION_TRANSMISSION -> robot.transmissionElements().forEach(t -> root.add(transmissionNode(t)));
            default -> throw new IllegalStateException("Unknown section: " + section);
        }
    }

    // ==================== Model to Nodes ====================

    private XmlNode materialNode(Material material) {
        XmlNode node = new XmlNode("material").attr("name", material.name());
        if (material.color() != null) {
            node.child("color").attr("rgba", NumberLists.join(
                finite(material.color().red()),
                finite(material.color().green()),
                finite(material.color().blue()),
                finite(material.color().alpha())));
        }
        if (material.texture() != null) {
            node.child("texture").attr("filename", material.texture().filename());
        }
        return node;
    }

    private XmlNode linkNode(Link link) {
        XmlNode node = new XmlNode("link").attr("name", link.name());
        if (link.inertial() != null) {
            node.add(inertialNode(link.inertial()));
        }
        for (Visual visual : link.visuals()) {
            XmlNode visualNode = node.child("visual").attr("name", visual.name());
            addOrigin(visualNode, visual.origin());
            addGeometry(visualNode, visual.geometry());
            if (visual.material() != null) {
                visualNode.child("material").attr("name", visual.material().name());
            }
        }
        for (Collision collision : link.collisions()) {
            XmlNode collisionNode = node.child("collision").attr("name", collision.name());
            addOrigin(collisionNode, collision.origin());
            addGeometry(collisionNode, collision.geometry());
        }
        return node;
    }

    private XmlNode inertialNode(Inertial inertial) {
        XmlNode node = new XmlNode("inertial");
        addOrigin(node, inertial.origin());
        node.child("mass").attr("value", number(inertial.mass()));
        Inertia inertia = inertial.inertia();
        if (inertia != null) {
            node.child("inertia")
                .attr("ixx", number(inertia.ixx()))
                .attr("ixy", number(inertia.ixy()))
                .attr("ixz", number(inertia.ixz()))
                .attr("iyy", number(inertia.iyy()))
                .attr("iyz", number(inertia.iyz()))
                .attr("izz", number(inertia.izz()));
        }
        return node;
    }

    private void addGeometry(XmlNode parent, Geometry geometry) {
        if (geometry == null) {
            return;
        }
        XmlNode shape = parent.child("geometry").child(geometry.shapeName());
        if (geometry instanceof Geometry.Box box) {
            shape.attr("size", vector(box.size()));
        } else if (geometry instanceof Geometry.Cylinder cylinder) {
            shape.attr("radius", number(cylinder.radius())).attr("length", number(cylinder.length()));
        } else if (geometry instanceof Geometry.Sphere sphere) {
            shape.attr("radius", number(sphere.radius()));
        } else if (geometry instanceof Geometry.Mesh mesh) {
            shape.attr("filename", mesh.filename());
            if (mesh.scale() != null) {
                shape.attr("scale", vector(mesh.scale()));
            }
        }
    }

    private XmlNode jointNode(Joint joint) {
        XmlNode node = new XmlNode("joint").attr("name", joint.name()).attr("type", joint.type());
        node.child("parent").attr("link", joint.parent());
        node.child("child").attr("link", joint.child());
        addOrigin(node, joint.origin());
        if (joint.axis() != null) {
            node.child("axis").attr("xyz", vector(joint.axis().xyz()));
        }
        Limit limit = joint.limit();
        if (limit != null) {
            node.child("limit")
                .attr("lower", optionalNumber(limit.lower()))
                .attr("upper", optionalNumber(limit.upper()))
                .attr("effort", optionalNumber(limit.effort()))
                .attr("velocity", optionalNumber(limit.velocity()));
        }
        if (joint.dynamics() != null) {
            node.child("dynamics")
                .attr("damping", optionalNumber(joint.dynamics().damping()))
                .attr("friction", optionalNumber(joint.dynamics().friction()));
        }
        if (joint.mimic() != null) {
            node.child("mimic")
                .attr("joint", joint.mimic().joint())
                .attr("multiplier", optionalNumber(joint.mimic().multiplier()))
                .attr("offset", optionalNumber(joint.mimic().offset()));
        }
        return node;
    }

    private static XmlNode gazeboNode(GazeboElement gazebo) {
        XmlNode node = new XmlNode("gazebo").attr("reference", gazebo.reference());
        gazebo.content().forEach(element -> node.add(XmlNode.from(element)));
        return node;
    }

    private static XmlNode transmissionNode(TransmissionElement transmission) {
        XmlNode node = new XmlNode("transmission").attr("name", transmission.name());
        transmission.content().forEach(element -> node.add(XmlNode.from(element)));
        return node;
    }

    private void addOrigin(XmlNode parent, Origin origin) {
        if (origin != null) {
            parent.child("origin").attr("xyz", vector(origin.xyz())).attr("rpy", vector(origin.rpy()));
        }
    }

    // ==================== Numbers ====================

    private static String vector(Vector3 v) {
        return NumberLists.join(finite(v.x()), finite(v.y()), finite(v.z()));
    }

    private static String number(double value) {
        return NumberLists.format(finite(value));
    }

    private static String optionalNumber(Double value) {
        return value == null ? null : number(value);
    }

    private static double finite(double value) {
        if (!Double.isFinite(value)) {
            throw UrdfException.encoding("Cannot encode non-finite number: " + value);
        }
        return value;
    }

    // ==================== Rendering ====================

    private void render(XmlNode node, int depth, FormatOptions options, StringBuilder sb) {
        String pad = options.indent().repeat(depth);
        String name = checked(node.name(), node.name());
        sb.append(pad).append('<').append(name);
        for (Map.Entry<String, String> attribute : orderedAttributes(node, options.attributeOrder())) {
            sb.append(' ')
                .append(checked(attribute.getKey(), name))
                .append("=\"")
                .append(escape(checked(attribute.getValue(), name), true))
                .append('"');
        }

        boolean hasText = !node.text().isEmpty();
        if (node.children().isEmpty() && !hasText) {
            sb.append(options.compactEmptyElements() ? "/>" : "></" + name + ">").append('\n');
            return;
        }
        if (node.children().isEmpty()) {
            sb.append('>').append(escape(checked(node.text(), name), false))
                .append("</").append(name).append(">\n");
            return;
        }

        sb.append(">\n");
        if (hasText) {
            sb.append(pad).append(options.indent()).append(escape(checked(node.text(), name), false)).append('\n');
        }
        for (XmlNode child : node.children()) {
            render(child, depth + 1, options, sb);
        }
        sb.append(pad).append("</").append(name).append(">\n");
    }

    private static List<Map.Entry<String, String>> orderedAttributes(XmlNode node, List<String> preferred) {
        List<Map.Entry<String, String>> attributes = new ArrayList<>(node.attributes().entrySet());
        // stable: unlisted attributes keep their natural order after the listed ones
        attributes.sort(Comparator.comparingInt(entry -> {
            int index = preferred.indexOf(entry.getKey());
            return index < 0 ? Integer.MAX_VALUE : index;
        }));
        return attributes;
    }

    /**
     * Verifies that every code point is a legal XML 1.0 character.
     */
    private static String checked(String value, String element) {
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            boolean legal = cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
            if (!legal) {
                throw UrdfException.encoding(String.format(
                    "Cannot encode character U+%04X in <%s>", cp, element));
            }
            i += Character.charCount(cp);
        }
        return value;
    }

    private static String escape(String value, boolean attribute) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append(attribute ? "&quot;" : "\"");
                case '\n' -> sb.append(attribute ? "&#10;" : "\n");
                case '\r' -> sb.append("&#13;");
                case '\t' -> sb.append(attribute ? "&#9;" : "\t");
                default -> sb.append(ch);
            }
        }
        return sb.toString();
    }

    private static void checkLineLengths(String text, int maxLineLength) {
        if (maxLineLength <= 0 || !log.isDebugEnabled()) {
            return;
        }
        String[] lines = text.split("\n");
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].length() > maxLineLength) {
                log.debug("Line {} exceeds {} characters ({})", i + 1, maxLineLength, lines[i].length());
            }
        }
    }
}

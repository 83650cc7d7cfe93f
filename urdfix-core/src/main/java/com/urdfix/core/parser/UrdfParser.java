package com.urdfix.core.parser;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.xml.XMLConstants;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.codehaus.stax2.XMLInputFactory2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.urdfix.core.UrdfException;
import com.urdfix.core.model.Axis;
import com.urdfix.core.model.Collision;
import com.urdfix.core.model.Color;
import com.urdfix.core.model.DuplicateReport;
import com.urdfix.core.model.Dynamics;
import com.urdfix.core.model.ElementKind;
import com.urdfix.core.model.GazeboElement;
import com.urdfix.core.model.Geometry;
import com.urdfix.core.model.Inertia;
import com.urdfix.core.model.Inertial;
import com.urdfix.core.model.Joint;
import com.urdfix.core.model.Limit;
import com.urdfix.core.model.Link;
import com.urdfix.core.model.Material;
import com.urdfix.core.model.MaterialRef;
import com.urdfix.core.model.Mimic;
import com.urdfix.core.model.OpaqueElement;
import com.urdfix.core.model.Origin;
import com.urdfix.core.model.Robot;
import com.urdfix.core.model.Texture;
import com.urdfix.core.model.TransmissionElement;
import com.urdfix.core.model.UrdfDocument;
import com.urdfix.core.model.Vector3;
import com.urdfix.core.model.Visual;
import com.urdfix.core.util.NumberLists;

/**
 * Parses URDF text into a {@link UrdfDocument}.
 *
 * <p>The parser makes a single forward pass over the StAX event stream of the
 * Woodstox {@link XMLInputFactory} configured by Jackson's {@link XmlFactory}. Every
 * element handler starts positioned on its start tag and returns positioned on the
 * matching end tag, so the caller always resumes at the same nesting level.
 *
 * <h2>Parsing Strategy</h2>
 * <ol>
 *   <li>Find the {@code robot} element; if several exist the last one wins</li>
 *   <li>Dispatch every child on its tag name: link, joint, material, gazebo, transmission</li>
 *   <li>Skip unrecognized elements by counting nesting depth up to the matching end tag</li>
 *   <li>Record names defined twice before the name-keyed maps collapse them</li>
 * </ol>
 *
 * <p>Parsing is all-or-nothing: the first problem raises a {@link UrdfException} and no
 * partial document is returned. DTD processing and external entities are disabled
 * since input is untrusted.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * UrdfParser parser = new UrdfParser();
 * UrdfDocument doc = parser.parseFile(Path.of("robot.urdf"));
 * Robot robot = doc.robot();
 * }</pre>
 */
public class UrdfParser {

    private static final Logger log = LoggerFactory.getLogger(UrdfParser.class);

    private static final String TAG_ROBOT = "robot";
    private static final String TAG_LINK = "link";
    private static final String TAG_JOINT = "joint";
    private static final String TAG_MATERIAL = "material";
    private static final String TAG_GAZEBO = "gazebo";
    private static final String TAG_TRANSMISSION = "transmission";
    private static final String TAG_INERTIAL = "inertial";
    private static final String TAG_VISUAL = "visual";
    private static final String TAG_COLLISION = "collision";
    private static final String TAG_ORIGIN = "origin";
    private static final String TAG_GEOMETRY = "geometry";
    private static final String TAG_PARENT = "parent";
    private static final String TAG_CHILD = "child";

    private static final String ATTR_NAME = "name";
    private static final String ATTR_TYPE = "type";
    private static final String ATTR_LINK = "link";
    private static final String ATTR_XYZ = "xyz";
    private static final String ATTR_RPY = "rpy";

    private final XMLInputFactory inputFactory;

    public UrdfParser() {
        this.inputFactory = new XmlFactory().getXMLInputFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
        // report malformed text from next() rather than lazily from getText()
        if (inputFactory.isPropertySupported(XMLInputFactory2.P_LAZY_PARSING)) {
            inputFactory.setProperty(XMLInputFactory2.P_LAZY_PARSING, false);
        }
    }

    /**
     * Reads and parses a URDF file.
     *
     * @param file path to the description
     * @return parsed document
     * @throws UrdfException IO if the file cannot be read, otherwise as {@link #parse(String)}
     */
    public UrdfDocument parseFile(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        log.debug("Reading URDF file: {}", file);
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw UrdfException.io("Failed to read " + file + ": " + e.getMessage(), e);
        }
        return parse(content);
    }

    /**
     * Parses URDF text.
     *
     * @param text document text
     * @return parsed document whose text is {@code text}
     * @throws UrdfException SYNTAX for malformed markup, MISSING_ATTRIBUTE for a missing
     *         required attribute, STRUCTURE for a missing robot or an invalid number list
     */
    public UrdfDocument parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            XMLStreamReader reader = inputFactory.createXMLStreamReader(new StringReader(text));
            Robot robot = null;
            DuplicateReport.Builder duplicates = new DuplicateReport.Builder();

            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                // elements outside a robot are descended into, not skipped
                if (TAG_ROBOT.equals(reader.getLocalName())) {
                    if (robot != null) {
                        log.warn("Document contains more than one <robot> element, keeping the last one");
                    }
                    duplicates = new DuplicateReport.Builder();
                    robot = parseRobot(reader, duplicates);
                }
            }
            reader.close();

            if (robot == null) {
                throw UrdfException.structure("No robot element found");
            }

            log.info("Parsed robot '{}': {} links, {} joints, {} materials",
                robot.name(), robot.links().size(), robot.joints().size(), robot.materials().size());
            return new UrdfDocument(robot, text, duplicates.build());
        } catch (XMLStreamException e) {
            throw UrdfException.syntax("Malformed XML: " + e.getMessage(), e);
        }
    }

    // ==================== Top-level Elements ====================

    private Robot parseRobot(XMLStreamReader reader, DuplicateReport.Builder duplicates)
            throws XMLStreamException {
        Robot robot = Robot.named(requiredAttribute(reader, TAG_ROBOT, ATTR_NAME));

        while (nextChild(reader, TAG_ROBOT)) {
            switch (reader.getLocalName()) {
                case TAG_LINK -> {
                    Link link = parseLink(reader);
                    if (duplicates.record(ElementKind.LINK, link.name())) {
                        log.warn("Link '{}' is defined more than once, keeping the last definition", link.name());
                    }
                    robot.putLink(link);
                }
                case TAG_JOINT -> {
                    Joint joint = parseJoint(reader);
                    if (duplicates.record(ElementKind.JOINT, joint.name())) {
                        log.warn("Joint '{}' is defined more than once, keeping the last definition", joint.name());
                    }
                    robot.putJoint(joint);
                }
                case TAG_MATERIAL -> {
                    Material material = parseMaterial(reader);
                    if (duplicates.record(ElementKind.MATERIAL, material.name())) {
                        log.warn("Material '{}' is defined more than once, keeping the last definition",
                            material.name());
                    }
                    robot.putMaterial(material);
                }
                case TAG_GAZEBO -> robot.gazeboElements().add(parseGazebo(reader));
                case TAG_TRANSMISSION -> robot.transmissionElements().add(parseTransmission(reader));
                default -> {
                    log.debug("Skipping unknown element <{}> in robot", reader.getLocalName());
                    skipElement(reader);
                }
            }
        }
        return robot;
    }

    private Link parseLink(XMLStreamReader reader) throws XMLStreamException {
        String name = requiredAttribute(reader, TAG_LINK, ATTR_NAME);
        Inertial inertial = null;
        List<Visual> visuals = new ArrayList<>();
        List<Collision> collisions = new ArrayList<>();

        while (nextChild(reader, TAG_LINK)) {
            switch (reader.getLocalName()) {
                case TAG_INERTIAL -> inertial = parseInertial(reader);
                case TAG_VISUAL -> visuals.add(parseVisual(reader));
                case TAG_COLLISION -> collisions.add(parseCollision(reader));
                default -> skipElement(reader);
            }
        }
        log.debug("Parsed link '{}' ({} visual, {} collision)", name, visuals.size(), collisions.size());
        return new Link(name, inertial, visuals, collisions);
    }

    private Joint parseJoint(XMLStreamReader reader) throws XMLStreamException {
        String name = requiredAttribute(reader, TAG_JOINT, ATTR_NAME);
        String type = requiredAttribute(reader, TAG_JOINT, ATTR_TYPE);
        String parent = null;
        String child = null;
        Origin origin = null;
        Axis axis = null;
        Limit limit = null;
        Dynamics dynamics = null;
        Mimic mimic = null;

        while (nextChild(reader, TAG_JOINT)) {
            switch (reader.getLocalName()) {
                case TAG_PARENT -> parent = requiredAttribute(reader, TAG_PARENT, ATTR_LINK);
                case TAG_CHILD -> child = requiredAttribute(reader, TAG_CHILD, ATTR_LINK);
                case TAG_ORIGIN -> origin = readOrigin(reader);
                case "axis" -> axis = new Axis(optionalVector(reader, ATTR_XYZ, Vector3.UNIT_X));
                case "limit" -> limit = new Limit(
                    optionalScalar(reader, "lower"),
                    optionalScalar(reader, "upper"),
                    optionalScalar(reader, "effort"),
                    optionalScalar(reader, "velocity"));
                case "dynamics" -> dynamics = new Dynamics(
                    optionalScalar(reader, "damping"),
                    optionalScalar(reader, "friction"));
                case "mimic" -> mimic = new Mimic(
                    requiredAttribute(reader, "mimic", TAG_JOINT),
                    optionalScalar(reader, "multiplier"),
                    optionalScalar(reader, "offset"));
                default -> {
                    // nothing to read
                }
            }
            skipElement(reader);
        }

        if (parent == null) {
            throw UrdfException.structure("Joint '" + name + "' has no <parent> element");
        }
        if (child == null) {
            throw UrdfException.structure("Joint '" + name + "' has no <child> element");
        }
        log.debug("Parsed joint '{}' ({}): {} -> {}", name, type, parent, child);
        return new Joint(name, type, parent, child, origin, axis, limit, dynamics, mimic);
    }

    private Material parseMaterial(XMLStreamReader reader) throws XMLStreamException {
        String name = requiredAttribute(reader, TAG_MATERIAL, ATTR_NAME);
        Color color = null;
        Texture texture = null;

        while (nextChild(reader, TAG_MATERIAL)) {
            switch (reader.getLocalName()) {
                case "color" -> {
                    double[] rgba = NumberLists.parse(requiredAttribute(reader, "color", "rgba"), 4);
                    color = new Color(rgba[0], rgba[1], rgba[2], rgba[3]);
                }
                case "texture" -> texture = new Texture(requiredAttribute(reader, "texture", "filename"));
                default -> {
                    // nothing to read
                }
            }
            skipElement(reader);
        }
        return new Material(name, color, texture);
    }

    private GazeboElement parseGazebo(XMLStreamReader reader) throws XMLStreamException {
        String reference = reader.getAttributeValue(null, "reference");
        return new GazeboElement(reference, readOpaqueChildren(reader, TAG_GAZEBO));
    }

    private TransmissionElement parseTransmission(XMLStreamReader reader) throws XMLStreamException {
        String name = requiredAttribute(reader, TAG_TRANSMISSION, ATTR_NAME);
        return new TransmissionElement(name, readOpaqueChildren(reader, TAG_TRANSMISSION));
    }

    // ==================== Link Content ====================

    private Inertial parseInertial(XMLStreamReader reader) throws XMLStreamException {
        double mass = 0.0;
        Origin origin = null;
        Inertia inertia = null;

        while (nextChild(reader, TAG_INERTIAL)) {
            switch (reader.getLocalName()) {
                case TAG_ORIGIN -> origin = readOrigin(reader);
                case "mass" -> mass = NumberLists.parseScalar(requiredAttribute(reader, "mass", "value"));
                case "inertia" -> inertia = new Inertia(
                    scalarOrZero(reader, "ixx"),
                    scalarOrZero(reader, "ixy"),
                    scalarOrZero(reader, "ixz"),
                    scalarOrZero(reader, "iyy"),
                    scalarOrZero(reader, "iyz"),
                    scalarOrZero(reader, "izz"));
                default -> {
                    // nothing to read
                }
            }
            skipElement(reader);
        }
        return new Inertial(mass, origin, inertia);
    }

    private Visual parseVisual(XMLStreamReader reader) throws XMLStreamException {
        String name = reader.getAttributeValue(null, ATTR_NAME);
        Origin origin = null;
        Geometry geometry = null;
        MaterialRef material = null;

        while (nextChild(reader, TAG_VISUAL)) {
            switch (reader.getLocalName()) {
                case TAG_ORIGIN -> {
                    origin = readOrigin(reader);
                    skipElement(reader);
                }
                case TAG_GEOMETRY -> geometry = parseGeometry(reader);
                case TAG_MATERIAL -> {
                    material = new MaterialRef(requiredAttribute(reader, TAG_MATERIAL, ATTR_NAME));
                    skipElement(reader);
                }
                default -> skipElement(reader);
            }
        }
        return new Visual(name, origin, geometry, material);
    }

    private Collision parseCollision(XMLStreamReader reader) throws XMLStreamException {
        String name = reader.getAttributeValue(null, ATTR_NAME);
        Origin origin = null;
        Geometry geometry = null;

        while (nextChild(reader, TAG_COLLISION)) {
            switch (reader.getLocalName()) {
                case TAG_ORIGIN -> {
                    origin = readOrigin(reader);
                    skipElement(reader);
                }
                case TAG_GEOMETRY -> geometry = parseGeometry(reader);
                default -> skipElement(reader);
            }
        }
        return new Collision(name, origin, geometry);
    }

    private Geometry parseGeometry(XMLStreamReader reader) throws XMLStreamException {
        Geometry geometry = null;

        while (nextChild(reader, TAG_GEOMETRY)) {
            Geometry shape = switch (reader.getLocalName()) {
                case "box" -> new Geometry.Box(vector(requiredAttribute(reader, "box", "size")));
                case "cylinder" -> new Geometry.Cylinder(
                    NumberLists.parseScalar(requiredAttribute(reader, "cylinder", "radius")),
                    NumberLists.parseScalar(requiredAttribute(reader, "cylinder", "length")));
                case "sphere" -> new Geometry.Sphere(
                    NumberLists.parseScalar(requiredAttribute(reader, "sphere", "radius")));
                case "mesh" -> new Geometry.Mesh(
                    requiredAttribute(reader, "mesh", "filename"),
                    optionalVector(reader, "scale", null));
                default -> null;
            };
            if (shape != null && geometry == null) {
                geometry = shape;
            }
            skipElement(reader);
        }
        return geometry;
    }

    // ==================== Opaque Content ====================

    private List<OpaqueElement> readOpaqueChildren(XMLStreamReader reader, String element)
            throws XMLStreamException {
        List<OpaqueElement> children = new ArrayList<>();
        while (nextChild(reader, element)) {
            children.add(readOpaque(reader, Set.of()));
        }
        return children;
    }

    /**
     * Captures the element the reader is positioned on, with its subtree.
     *
     * <p>Namespace declarations are kept as {@code xmlns}/{@code xmlns:p} attributes.
     * A prefix used here but bound outside the block (on {@code robot}, say) is declared
     * on the outermost element that uses it, so every captured block can be written
     * back on its own.
     *
     * @param declared prefixes already declared by enclosing captured elements
     */
    private OpaqueElement readOpaque(XMLStreamReader reader, Set<String> declared) throws XMLStreamException {
        String name = qualifiedName(reader.getPrefix(), reader.getLocalName());
        Map<String, String> attributes = new LinkedHashMap<>();
        Set<String> inScope = new HashSet<>(declared);
        for (int i = 0; i < reader.getNamespaceCount(); i++) {
            declareNamespace(attributes, inScope, reader.getNamespacePrefix(i), reader.getNamespaceURI(i));
        }
        declareInherited(attributes, inScope, reader.getPrefix(), reader.getNamespaceURI());
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            declareInherited(attributes, inScope, reader.getAttributePrefix(i), reader.getAttributeNamespace(i));
        }
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.put(
                qualifiedName(reader.getAttributePrefix(i), reader.getAttributeLocalName(i)),
                reader.getAttributeValue(i));
        }

        StringBuilder text = new StringBuilder();
        List<OpaqueElement> children = new ArrayList<>();
        while (true) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT -> children.add(readOpaque(reader, inScope));
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> text.append(reader.getText());
                case XMLStreamConstants.END_ELEMENT -> {
                    return new OpaqueElement(name, attributes, text.toString().strip(), children);
                }
                case XMLStreamConstants.END_DOCUMENT -> throw unexpectedEnd(name);
                default -> {
                    // comments and processing instructions are dropped
                }
            }
        }
    }

    private static void declareInherited(Map<String, String> attributes, Set<String> inScope,
                                         String prefix, String uri) {
        String key = prefix == null ? "" : prefix;
        if (uri == null || uri.isEmpty() || XMLConstants.XML_NS_PREFIX.equals(key) || inScope.contains(key)) {
            return;
        }
        declareNamespace(attributes, inScope, key, uri);
    }

    private static void declareNamespace(Map<String, String> attributes, Set<String> inScope,
                                         String prefix, String uri) {
        String key = prefix == null ? "" : prefix;
        inScope.add(key);
        String attribute = key.isEmpty()
            ? XMLConstants.XMLNS_ATTRIBUTE
            : XMLConstants.XMLNS_ATTRIBUTE + ":" + key;
        attributes.put(attribute, uri == null ? "" : uri);
    }

    private static String qualifiedName(String prefix, String localName) {
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    // ==================== Stream Navigation ====================

    /**
     * Advances to the next child start tag of the current element.
     *
     * @return true if positioned on a child start tag, false if positioned on the
     *         end tag of {@code element}
     */
    private boolean nextChild(XMLStreamReader reader, String element) throws XMLStreamException {
        while (true) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT -> {
                    return true;
                }
                case XMLStreamConstants.END_ELEMENT -> {
                    return false;
                }
                case XMLStreamConstants.END_DOCUMENT -> throw unexpectedEnd(element);
                default -> {
                    // text, comments, whitespace
                }
            }
        }
    }

    /**
     * Consumes everything up to and including the end tag of the element whose start
     * tag the reader is positioned on, whatever its nesting depth.
     */
    private void skipElement(XMLStreamReader reader) throws XMLStreamException {
        String element = reader.getLocalName();
        int depth = 1;
        while (depth > 0) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT -> depth++;
                case XMLStreamConstants.END_ELEMENT -> depth--;
                case XMLStreamConstants.END_DOCUMENT -> throw unexpectedEnd(element);
                default -> {
                    // ignored
                }
            }
        }
    }

    private static UrdfException unexpectedEnd(String element) {
        return UrdfException.structure("Unexpected end of file inside <" + element + ">");
    }

    // ==================== Attributes ====================

    private static String requiredAttribute(XMLStreamReader reader, String element, String attribute) {
        String value = reader.getAttributeValue(null, attribute);
        if (value == null) {
            throw UrdfException.missingAttribute(element, attribute);
        }
        return value;
    }

    private static Origin readOrigin(XMLStreamReader reader) {
        return new Origin(
            optionalVector(reader, ATTR_XYZ, Vector3.ZERO),
            optionalVector(reader, ATTR_RPY, Vector3.ZERO));
    }

    private static Vector3 optionalVector(XMLStreamReader reader, String attribute, Vector3 defaultValue) {
        String value = reader.getAttributeValue(null, attribute);
        return value == null ? defaultValue : vector(value);
    }

    private static Vector3 vector(String value) {
        double[] xyz = NumberLists.parse(value, 3);
        return new Vector3(xyz[0], xyz[1], xyz[2]);
    }

    private static Double optionalScalar(XMLStreamReader reader, String attribute) {
        String value = reader.getAttributeValue(null, attribute);
        return value == null ? null : NumberLists.parseScalar(value);
    }

    private static double scalarOrZero(XMLStreamReader reader, String attribute) {
        Double value = optionalScalar(reader, attribute);
        return value == null ? 0.0 : value;
    }
}

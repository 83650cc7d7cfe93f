package com.urdfix.core.generator;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.urdfix.core.UrdfException;
import com.urdfix.core.UrdfTestBase;
import com.urdfix.core.model.Geometry;
import com.urdfix.core.model.Joint;
import com.urdfix.core.model.Link;
import com.urdfix.core.model.Robot;
import com.urdfix.core.model.Visual;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link UrdfWriter}.
 */
class UrdfWriterTest extends UrdfTestBase {

    private UrdfWriter writer;

    @BeforeEach
    void setUp() {
        writer = new UrdfWriter();
    }

    // ==================== Layout ====================

    @Test
    void write_singleLink_selfClosesWithDefaults() {
        Robot robot = Robot.named("test");
        robot.putLink(Link.empty("base_link"));

        assertThat(writer.write(robot, FormatOptions.defaults())).isEqualTo("""
            <?xml version="1.0"?>
            <robot name="test">
              <link name="base_link"/>
            </robot>
            """);
    }

    @Test
    void write_withoutCompaction_writesOpenCloseTags() {
        Robot robot = Robot.named("test");
        robot.putLink(Link.empty("base_link"));

        String text = writer.write(robot, FormatOptions.defaults().withCompactEmptyElements(false));

        assertThat(text).contains("  <link name=\"base_link\"></link>\n");
    }

    @Test
    void write_customIndent_indentsEachLevel() {
        Robot robot = parseRobot("""
            <link name="l"><visual><geometry><sphere radius="0.5"/></geometry></visual></link>
            """).robot();

        String text = writer.write(robot, FormatOptions.defaults().withIndent("    "));

        assertThat(text).contains(
            "    <link name=\"l\">\n"
                + "        <visual>\n"
                + "            <geometry>\n"
                + "                <sphere radius=\"0.5\"/>\n");
    }

    @Test
    void write_elementOrderHint_movesListedSectionsFirst() {
        Robot robot = parseRobot("""
            <material name="m"/>
            <link name="a"/><link name="b"/>
            <joint name="j" type="fixed"><parent link="a"/><child link="b"/></joint>
            """).robot();

        String text = writer.write(robot,
            FormatOptions.defaults().withElementOrder(List.of("joint", "unknown", "link")));

        int joint = text.indexOf("<joint ");
        int link = text.indexOf("<link ");
        int material = text.indexOf("<material ");
        assertThat(joint).isLessThan(link);
        assertThat(link).isLessThan(material);
    }

    @Test
    void write_attributeOrder_putsPreferredAttributesFirst() {
        Robot robot = Robot.named("test");
        robot.putJoint(Joint.of("j", "fixed", "a", "b"));
        FormatOptions options = new FormatOptions("  ", List.of("type", "name"), null, true, 0);

        assertThat(writer.write(robot, options)).contains("<joint type=\"fixed\" name=\"j\">");
    }

    @Test
    void write_opaqueBlocks_preservesContentAndEscapes() {
        Robot robot = parseRobot("""
            <link name="l"/>
            <gazebo reference="l">
              <plugin name="p" filename="lib.so"><topic>a &amp; b</topic></plugin>
            </gazebo>
            """).robot();

        String text = writer.write(robot, FormatOptions.defaults());

        assertThat(text).contains(
            "  <gazebo reference=\"l\">\n"
                + "    <plugin name=\"p\" filename=\"lib.so\">\n"
                + "      <topic>a &amp; b</topic>\n"
                + "    </plugin>\n"
                + "  </gazebo>\n");
    }

    // ==================== Numbers ====================

    @Test
    void write_numbers_useShortestPlainDecimal() {
        Robot robot = parseRobot("""
            <link name="l">
              <visual><geometry><sphere radius="1.0"/></geometry></visual>
              <collision><geometry><sphere radius="1e-10"/></geometry></collision>
            </link>
            """).robot();

        String text = writer.write(robot, FormatOptions.defaults());

        assertThat(text)
            .contains("<sphere radius=\"1\"/>")
            .contains("<sphere radius=\"0.0000000001\"/>");
    }

    @Test
    void write_origin_alwaysWritesBothAttributes() {
        Robot robot = parseRobot("""
            <link name="l"><visual><origin xyz="0 0 0.2"/><geometry><sphere radius="1"/></geometry></visual></link>
            """).robot();

        assertThat(writer.write(robot, FormatOptions.defaults()))
            .contains("<origin xyz=\"0 0 0.2\" rpy=\"0 0 0\"/>");
    }

    // ==================== Round Trip ====================

    @Test
    void write_singleLinkDocument_reparsesToEqualModel() {
        // Given
        Robot original = parseRobot("<link name=\"base_link\"/>").robot();

        // When
        Robot reparsed = parse(writer.write(original, FormatOptions.defaults())).robot();

        // Then
        assertThat(reparsed).isEqualTo(original);
        assertThat(reparsed.links().keySet()).containsExactly("base_link");
    }

    @Test
    void write_fixture_reparsesToEqualModel() {
        Robot original = parseFixture("arm.urdf").robot();

        Robot reparsed = parse(writer.write(original, FormatOptions.defaults())).robot();

        assertThat(reparsed).isEqualTo(original);
    }

    @Test
    void write_namespacedGazeboPayload_reparsesToEqualModel() {
        // Given
        Robot original = parse("""
            <robot name="r" xmlns:g="urn:g">
              <link name="a"/>
              <gazebo reference="a"><g:plugin g:mode="x"/></gazebo>
            </robot>
            """).robot();

        // When
        String text = writer.write(original, FormatOptions.defaults());

        // Then
        assertThat(text).contains("<g:plugin xmlns:g=\"urn:g\" g:mode=\"x\"/>");
        assertThat(parse(text).robot()).isEqualTo(original);
    }

    @Test
    void write_sameModelTwice_producesSameText() {
        Robot robot = parseFixture("arm.urdf").robot();

        assertThat(writer.write(robot, FormatOptions.defaults()))
            .isEqualTo(writer.write(robot.copy(), FormatOptions.defaults()));
    }

    // ==================== Encoding Errors ====================

    @Test
    void write_controlCharacterInName_throwsEncoding() {
        Robot robot = Robot.named("test");
        robot.putLink(Link.empty("bad\u0001name"));

        assertThatThrownBy(() -> writer.write(robot, FormatOptions.defaults()))
            .isInstanceOf(UrdfException.class)
            .hasMessage("Cannot encode character U+0001 in <link>")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(UrdfException.ErrorKind.ENCODING);
    }

    @Test
    void write_nonFiniteNumber_throwsEncoding() {
        Robot robot = Robot.named("test");
        robot.putLink(new Link("l", null,
            List.of(new Visual(null, null, new Geometry.Sphere(Double.NaN), null)), null));

        assertThatThrownBy(() -> writer.write(robot, FormatOptions.defaults()))
            .isInstanceOf(UrdfException.class)
            .hasMessageContaining("non-finite")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(UrdfException.ErrorKind.ENCODING);
    }
}

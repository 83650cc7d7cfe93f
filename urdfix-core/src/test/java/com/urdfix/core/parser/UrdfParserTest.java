package com.urdfix.core.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.urdfix.core.UrdfException;
import com.urdfix.core.UrdfException.ErrorKind;
import com.urdfix.core.UrdfTestBase;
import com.urdfix.core.model.Axis;
import com.urdfix.core.model.ElementKind;
import com.urdfix.core.model.GazeboElement;
import com.urdfix.core.model.Geometry;
import com.urdfix.core.model.Joint;
import com.urdfix.core.model.Limit;
import com.urdfix.core.model.Link;
import com.urdfix.core.model.Origin;
import com.urdfix.core.model.OpaqueElement;
import com.urdfix.core.model.Robot;
import com.urdfix.core.model.TransmissionElement;
import com.urdfix.core.model.UrdfDocument;
import com.urdfix.core.model.Vector3;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link UrdfParser}.
 */
class UrdfParserTest extends UrdfTestBase {

    @TempDir
    Path tempDir;

    @Test
    void parse_fixture_readsAllSections() {
        // Given
        String text = fixture("arm.urdf");

        // When
        UrdfDocument doc = parser.parse(text);

        // Then
        Robot robot = doc.robot();
        assertThat(doc.text()).isEqualTo(text);
        assertThat(robot.name()).isEqualTo("arm");
        assertThat(robot.links()).containsOnlyKeys("base_link", "upper_arm", "gripper_left", "gripper_right");
        assertThat(robot.links().keySet()).containsExactly("base_link", "upper_arm", "gripper_left", "gripper_right");
        assertThat(robot.joints().keySet()).containsExactly("shoulder", "finger_left", "finger_right");
        assertThat(robot.materials().keySet()).containsExactly("grey", "red");
        assertThat(robot.gazeboElements()).hasSize(1);
        assertThat(robot.transmissionElements()).hasSize(1);
        assertThat(doc.duplicates().isEmpty()).isTrue();
    }

    @Test
    void parse_link_readsInertialVisualAndCollision() {
        UrdfDocument doc = parseFixture("arm.urdf");

        Link base = doc.robot().links().get("base_link");
        assertThat(base.inertial().mass()).isEqualTo(2.5);
        assertThat(base.inertial().origin().xyz()).isEqualTo(Vector3.of(0, 0, 0.05));
        assertThat(base.inertial().inertia().izz()).isEqualTo(0.02);
        assertThat(base.visuals()).hasSize(1);
        assertThat(base.visuals().get(0).geometry()).isEqualTo(new Geometry.Cylinder(0.1, 0.1));
        assertThat(base.visuals().get(0).material().name()).isEqualTo("grey");
        assertThat(base.collisions()).hasSize(1);

        Link upperArm = doc.robot().links().get("upper_arm");
        assertThat(upperArm.inertial()).isNull();
        assertThat(upperArm.visuals().get(0).name()).isEqualTo("upper_arm_visual");
        assertThat(upperArm.visuals().get(0).origin()).isEqualTo(new Origin(Vector3.of(0, 0, 0.2), Vector3.ZERO));
        assertThat(upperArm.visuals().get(0).geometry()).isEqualTo(new Geometry.Box(Vector3.of(0.05, 0.05, 0.4)));

        assertThat(doc.robot().links().get("gripper_left").isEmpty()).isTrue();
    }

    @Test
    void parse_joint_readsAllSubElements() {
        UrdfDocument doc = parseFixture("arm.urdf");

        Joint shoulder = doc.robot().joints().get("shoulder");
        assertThat(shoulder.type()).isEqualTo(Joint.REVOLUTE);
        assertThat(shoulder.parent()).isEqualTo("base_link");
        assertThat(shoulder.child()).isEqualTo("upper_arm");
        assertThat(shoulder.axis()).isEqualTo(new Axis(Vector3.of(0, 1, 0)));
        assertThat(shoulder.limit()).isEqualTo(new Limit(-1.57, 1.57, 10.0, 1.0));
        assertThat(shoulder.dynamics().damping()).isEqualTo(0.1);
        assertThat(shoulder.dynamics().friction()).isNull();
        assertThat(shoulder.mimic()).isNull();

        Joint fingerRight = doc.robot().joints().get("finger_right");
        assertThat(fingerRight.mimic().joint()).isEqualTo("finger_left");
        assertThat(fingerRight.mimic().multiplier()).isEqualTo(1.0);
        assertThat(fingerRight.origin()).isNull();
        assertThat(fingerRight.axis()).isNull();
    }

    @Test
    void parse_opaqueBlocks_keepNestedContent() {
        UrdfDocument doc = parseFixture("arm.urdf");

        GazeboElement gazebo = doc.robot().gazeboElements().get(0);
        assertThat(gazebo.reference()).isEqualTo("upper_arm");
        assertThat(gazebo.content()).containsExactly(
            new OpaqueElement("material", null, "Gazebo/Grey", null));

        TransmissionElement transmission = doc.robot().transmissionElements().get(0);
        assertThat(transmission.name()).isEqualTo("shoulder_trans");
        assertThat(transmission.content()).extracting(OpaqueElement::name)
            .containsExactly("type", "joint", "actuator");
        OpaqueElement joint = transmission.content().get(1);
        assertThat(joint.attributes()).containsEntry("name", "shoulder");
        assertThat(joint.children().get(0).text()).isEqualTo("EffortJointInterface");
    }

    @Test
    void parse_elementsWithoutAttributes_applyDefaults() {
        UrdfDocument doc = parseRobot("""
            <link name="a"/>
            <link name="b"/>
            <joint name="j" type="continuous">
              <parent link="a"/>
              <child link="b"/>
              <origin/>
              <axis/>
            </joint>
            """);

        Joint joint = doc.robot().joints().get("j");
        assertThat(joint.origin()).isEqualTo(new Origin(Vector3.ZERO, Vector3.ZERO));
        assertThat(joint.axis().xyz()).isEqualTo(Vector3.UNIT_X);
        assertThat(joint.limit()).isNull();
    }

    @Test
    void parse_unknownElements_areSkippedWithTheirContent() {
        UrdfDocument doc = parseRobot("""
            <extension>
              <nested><link name="hidden"/></nested>
            </extension>
            <link name="visible">
              <sensor type="camera"><camera><image width="640"/></camera></sensor>
              <visual><geometry><sphere radius="0.5"/></geometry></visual>
            </link>
            """);

        assertThat(doc.robot().links()).containsOnlyKeys("visible");
        assertThat(doc.robot().links().get("visible").visuals().get(0).geometry())
            .isEqualTo(new Geometry.Sphere(0.5));
    }

    @Test
    void parse_duplicateNames_keepLastDefinitionAndRecordName() {
        UrdfDocument doc = parseRobot("""
            <link name="a"><visual><geometry><sphere radius="1"/></geometry></visual></link>
            <link name="b"/>
            <link name="a"/>
            <material name="m"/>
            <material name="m"/>
            """);

        assertThat(doc.robot().links().keySet()).containsExactly("a", "b");
        assertThat(doc.robot().links().get("a").isEmpty()).isTrue();
        assertThat(doc.duplicates().namesFor(ElementKind.LINK)).containsExactly("a");
        assertThat(doc.duplicates().namesFor(ElementKind.MATERIAL)).containsExactly("m");
        assertThat(doc.duplicates().namesFor(ElementKind.JOINT)).isEmpty();
    }

    @Test
    void parse_severalRobots_lastOneWins() {
        UrdfDocument doc = parser.parse("""
            <descriptions>
              <robot name="first"><link name="a"/><link name="a"/></robot>
              <robot name="second"><link name="b"/></robot>
            </descriptions>
            """);

        assertThat(doc.robot().name()).isEqualTo("second");
        assertThat(doc.robot().links()).containsOnlyKeys("b");
        assertThat(doc.duplicates().isEmpty()).isTrue();
    }

    @Test
    void parse_noRobotElement_throwsStructureError() {
        assertThatThrownBy(() -> parser.parse("<model name=\"x\"><link name=\"a\"/></model>"))
            .isInstanceOf(UrdfException.class)
            .hasMessage("No robot element found")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.STRUCTURE);
    }

    @Test
    void parse_unbalancedMarkup_throwsSyntaxError() {
        assertThatThrownBy(() -> parser.parse("<robot name=\"x\"><link name=\"a\"></robot>"))
            .isInstanceOf(UrdfException.class)
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.SYNTAX);
    }

    @Test
    void parse_missingRequiredAttributes_throwMissingAttribute() {
        assertThatThrownBy(() -> parseRobot("<link/>"))
            .isInstanceOf(UrdfException.class)
            .hasMessageContaining("'name'")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.MISSING_ATTRIBUTE);

        assertThatThrownBy(() -> parseRobot("""
            <joint name="j" type="fixed"><parent/><child link="b"/></joint>
            """))
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.MISSING_ATTRIBUTE);

        assertThatThrownBy(() -> parseRobot("""
            <link name="a"><visual><geometry><box/></geometry></visual></link>
            """))
            .hasMessageContaining("'size'")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.MISSING_ATTRIBUTE);
    }

    @Test
    void parse_jointWithoutChildElement_throwsStructureError() {
        assertThatThrownBy(() -> parseRobot("""
            <joint name="j" type="fixed"><parent link="a"/></joint>
            """))
            .isInstanceOf(UrdfException.class)
            .hasMessageContaining("<child>")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.STRUCTURE);
    }

    @Test
    void parse_wrongArity_throwsStructureError() {
        assertThatThrownBy(() -> parseRobot("""
            <joint name="j" type="fixed">
              <parent link="a"/><child link="b"/><origin xyz="1 2"/>
            </joint>
            """))
            .isInstanceOf(UrdfException.class)
            .hasMessageContaining("Expected 3 values, got 2")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.STRUCTURE);
    }

    @Test
    void parse_nonNumericToken_throwsStructureError() {
        assertThatThrownBy(() -> parseRobot("""
            <material name="m"><color rgba="1 0 zero 1"/></material>
            """))
            .isInstanceOf(UrdfException.class)
            .hasMessageContaining("1 0 zero 1")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.STRUCTURE);
    }

    @Test
    void parse_overflowingNumber_throwsStructureError() {
        assertThatThrownBy(() -> parseRobot("""
            <link name="l"><visual><geometry><sphere radius="1e400"/></geometry></visual></link>
            """))
            .isInstanceOf(UrdfException.class)
            .hasMessageContaining("1e400")
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.STRUCTURE);
    }

    @Test
    void parse_namespacedGazeboPayload_keepsDeclarationsOnCapturedElements() {
        // Given
        String text = """
            <robot name="r" xmlns:g="urn:g">
              <link name="a"/>
              <gazebo reference="a">
                <g:plugin g:mode="x"><g:topic>/a</g:topic></g:plugin>
                <sensor xmlns:s="urn:s" s:rate="10"/>
              </gazebo>
            </robot>
            """;

        // When
        GazeboElement gazebo = parse(text).robot().gazeboElements().get(0);

        // Then
        OpaqueElement plugin = gazebo.content().get(0);
        assertThat(plugin.name()).isEqualTo("g:plugin");
        assertThat(plugin.attributes())
            .containsEntry("xmlns:g", "urn:g")
            .containsEntry("g:mode", "x");
        assertThat(plugin.children().get(0).attributes()).isEmpty();
        assertThat(gazebo.content().get(1).attributes())
            .containsOnlyKeys("xmlns:s", "s:rate");
    }

    @Test
    void parseFile_existingFile_parsesContent() throws IOException {
        Path file = tempDir.resolve("arm.urdf");
        Files.writeString(file, fixture("arm.urdf"));

        UrdfDocument doc = parser.parseFile(file);

        assertThat(doc.robot().name()).isEqualTo("arm");
    }

    @Test
    void parseFile_missingFile_throwsIoError() {
        Path missing = tempDir.resolve("missing.urdf");

        assertThatThrownBy(() -> parser.parseFile(missing))
            .isInstanceOf(UrdfException.class)
            .extracting(e -> ((UrdfException) e).kind())
            .isEqualTo(ErrorKind.IO);
    }
}

package com.urdfix.core.model;

import java.util.Objects;

/**
 * A parsed robot description together with its current text form.
 *
 * <p>The document owns its {@link Robot} exclusively. The text is the parsed input
 * until the first regeneration, afterwards it always reflects the model. Edits go
 * through {@link #commit(Robot, String)} so that the model and its text are replaced
 * together. Not thread-safe.
 */
public final class UrdfDocument {

    private Robot robot;
    private String text;
    private DuplicateReport duplicates;

    public UrdfDocument(Robot robot, String text, DuplicateReport duplicates) {
        this.robot = Objects.requireNonNull(robot, "robot must not be null");
        this.text = text == null ? "" : text;
        this.duplicates = duplicates == null ? DuplicateReport.none() : duplicates;
    }

    public UrdfDocument(Robot robot, String text) {
        this(robot, text, DuplicateReport.none());
    }

    public Robot robot() {
        return robot;
    }

    public String text() {
        return text;
    }

    public DuplicateReport duplicates() {
        return duplicates;
    }

    /**
     * Replaces the model and its regenerated text in one step.
     *
     * @param newRobot the edited robot
     * @param newText text regenerated from {@code newRobot}
     */
    public void commit(Robot newRobot, String newText) {
        this.robot = Objects.requireNonNull(newRobot, "robot must not be null");
        this.text = Objects.requireNonNull(newText, "text must not be null");
    }

    /**
     * Forgets the duplicate names recorded at parse time.
     */
    public void clearDuplicates() {
        this.duplicates = DuplicateReport.none();
    }
}

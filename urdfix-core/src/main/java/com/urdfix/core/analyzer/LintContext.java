package com.urdfix.core.analyzer;

import java.util.Objects;

import com.urdfix.core.model.Robot;
import com.urdfix.core.model.UrdfDocument;

/**
 * Input shared by all lint rules of one lint run.
 *
 * @param document document under inspection
 * @param graph kinematic graph of the document's robot
 */
public record LintContext(
    UrdfDocument document,
    KinematicGraph graph
) {
    public LintContext {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
    }

    /**
     * Creates a context for a document, building its graph.
     *
     * @param document document under inspection
     * @return lint context
     */
    public static LintContext of(UrdfDocument document) {
        return new LintContext(document, KinematicGraph.of(document.robot()));
    }

    public Robot robot() {
        return document.robot();
    }
}

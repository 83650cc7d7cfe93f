package com.urdfix.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import com.urdfix.core.model.UrdfDocument;
import com.urdfix.core.parser.UrdfParser;

/**
 * Base class for tests that work on parsed documents.
 *
 * <p>Provides a parser, access to the fixtures under {@code src/test/resources/fixtures}
 * and a helper that wraps element snippets into a robot document.
 */
public abstract class UrdfTestBase {

    protected final UrdfParser parser = new UrdfParser();

    /**
     * Reads a fixture file from the classpath.
     *
     * @param name file name under {@code fixtures/}
     * @return file content
     */
    protected String fixture(String name) {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Wraps element snippets into {@code <robot name="test">}.
     *
     * @param body robot children
     * @return document text
     */
    protected String robot(String body) {
        return "<?xml version=\"1.0\"?>\n<robot name=\"test\">\n" + body + "\n</robot>\n";
    }

    protected UrdfDocument parse(String text) {
        return parser.parse(text);
    }

    protected UrdfDocument parseRobot(String body) {
        return parser.parse(robot(body));
    }

    protected UrdfDocument parseFixture(String name) {
        return parser.parse(fixture(name));
    }
}

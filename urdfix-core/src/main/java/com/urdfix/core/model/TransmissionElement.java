package com.urdfix.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Actuator transmission block.
 *
 * @param name transmission name
 * @param content nested elements, kept opaque
 */
public record TransmissionElement(
    String name,
    List<OpaqueElement> content
) {
    public TransmissionElement {
        Objects.requireNonNull(name, "name must not be null");
        content = content == null ? List.of() : List.copyOf(content);
    }

    public TransmissionElement withContent(List<OpaqueElement> newContent) {
        return new TransmissionElement(name, newContent);
    }
}

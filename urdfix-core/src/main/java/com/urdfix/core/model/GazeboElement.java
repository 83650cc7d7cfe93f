package com.urdfix.core.model;

import java.util.List;

/**
 * Simulator extension block.
 *
 * @param reference optional name of the link or joint the block applies to
 * @param content nested elements, kept opaque
 */
public record GazeboElement(
    String reference,
    List<OpaqueElement> content
) {
    public GazeboElement {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public GazeboElement withReference(String newReference) {
        return new GazeboElement(newReference, content);
    }
}

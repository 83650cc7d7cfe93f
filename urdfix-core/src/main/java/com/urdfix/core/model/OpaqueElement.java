package com.urdfix.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Element captured without interpretation, used for the payload of
 * {@code gazebo} and {@code transmission} blocks.
 *
 * @param name element name
 * @param attributes attributes in document order
 * @param text trimmed text content, empty if none
 * @param children nested elements in document order
 */
public record OpaqueElement(
    String name,
    Map<String, String> attributes,
    String text,
    List<OpaqueElement> children
) {
    /**
     * Compact constructor with validation.
     */
    public OpaqueElement {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (text == null) {
            text = "";
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Returns true if the element has neither text nor children.
     *
     * @return true for an element that can be written self-closing
     */
    public boolean isEmpty() {
        return text.isEmpty() && children.isEmpty();
    }

    /**
     * Returns a copy with one attribute replaced, keeping attribute order.
     *
     * @param key attribute name
     * @param value new value
     * @return updated element
     */
    public OpaqueElement withAttribute(String key, String value) {
        Map<String, String> updated = new LinkedHashMap<>(attributes);
        updated.put(key, value);
        return new OpaqueElement(name, updated, text, children);
    }

    public OpaqueElement withChildren(List<OpaqueElement> newChildren) {
        return new OpaqueElement(name, attributes, text, newChildren);
    }
}

package com.urdfix.core.generator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.urdfix.core.model.OpaqueElement;

/**
 * Mutable element tree assembled by {@link UrdfWriter} before rendering.
 */
final class XmlNode {

    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<XmlNode> children = new ArrayList<>();
    private String text = "";

    XmlNode(String name) {
        this.name = name;
    }

    static XmlNode from(OpaqueElement element) {
        XmlNode node = new XmlNode(element.name());
        node.attributes.putAll(element.attributes());
        node.text = element.text();
        element.children().forEach(child -> node.add(from(child)));
        return node;
    }

    /**
     * Sets an attribute unless the value is null.
     */
    XmlNode attr(String key, String value) {
        if (value != null) {
            attributes.put(key, value);
        }
        return this;
    }

    XmlNode add(XmlNode child) {
        children.add(child);
        return this;
    }

    XmlNode child(String childName) {
        XmlNode child = new XmlNode(childName);
        children.add(child);
        return child;
    }

    String name() {
        return name;
    }

    Map<String, String> attributes() {
        return attributes;
    }

    List<XmlNode> children() {
        return children;
    }

    String text() {
        return text;
    }
}

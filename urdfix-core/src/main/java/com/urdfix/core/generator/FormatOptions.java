package com.urdfix.core.generator;

import java.util.List;

/**
 * Formatting settings for regenerated URDF text.
 *
 * @param indent indentation unit per nesting level
 * @param attributeOrder preferred attribute order, unlisted attributes keep their natural order after these
 * @param elementOrder preferred order of the top-level sections ({@code material}, {@code link},
 *        {@code joint}, {@code gazebo}, {@code transmission}), unlisted sections follow in default order
 * @param compactEmptyElements write elements without content as self-closing tags
 * @param maxLineLength advisory line length, longer lines are only logged; 0 disables the check
 */
public record FormatOptions(
    String indent,
    List<String> attributeOrder,
    List<String> elementOrder,
    boolean compactEmptyElements,
    int maxLineLength
) {
    public static final List<String> DEFAULT_ATTRIBUTE_ORDER = List.of("name", "type", "link", "joint", "xyz", "rpy");
    public static final List<String> DEFAULT_ELEMENT_ORDER = List.of("material", "link", "joint", "gazebo", "transmission");

    /**
     * Compact constructor with defaults.
     */
    public FormatOptions {
        if (indent == null) {
            indent = "  ";
        }
        attributeOrder = attributeOrder == null ? DEFAULT_ATTRIBUTE_ORDER : List.copyOf(attributeOrder);
        elementOrder = elementOrder == null ? DEFAULT_ELEMENT_ORDER : List.copyOf(elementOrder);
        if (maxLineLength < 0) {
            maxLineLength = 0;
        }
    }

    /**
     * Creates the default formatting: two-space indent, self-closing empty elements,
     * 120 character advisory line length.
     *
     * @return default format options
     */
    public static FormatOptions defaults() {
        return new FormatOptions("  ", DEFAULT_ATTRIBUTE_ORDER, DEFAULT_ELEMENT_ORDER, true, 120);
    }

    public FormatOptions withIndent(String newIndent) {
        return new FormatOptions(newIndent, attributeOrder, elementOrder, compactEmptyElements, maxLineLength);
    }

    public FormatOptions withCompactEmptyElements(boolean compact) {
        return new FormatOptions(indent, attributeOrder, elementOrder, compact, maxLineLength);
    }

    public FormatOptions withElementOrder(List<String> newElementOrder) {
        return new FormatOptions(indent, attributeOrder, newElementOrder, compactEmptyElements, maxLineLength);
    }
}

package com.urdfix.core.model;

/**
 * Kinds of name-keyed robot elements that can be removed or renamed.
 */
public enum ElementKind {
    LINK("link"),
    JOINT("joint"),
    MATERIAL("material");

    private final String tag;

    ElementKind(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the URDF element name of this kind.
     *
     * @return tag name
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a kind from its tag name.
     *
     * @param tag tag name ({@code link}, {@code joint} or {@code material})
     * @return matching kind
     * @throws IllegalArgumentException if the tag is not a known kind
     */
    public static ElementKind fromTag(String tag) {
        for (ElementKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown element kind: " + tag);
    }
}

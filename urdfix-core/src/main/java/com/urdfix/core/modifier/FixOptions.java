package com.urdfix.core.modifier;

/**
 * Selects the transforms applied by {@link UrdfModifier#fix}.
 *
 * <p>Enabled transforms always run in this order: remove duplicates, remove unused
 * materials, fix naming, add missing properties, sort elements, clean whitespace.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * FixOptions options = FixOptions.builder()
 *     .fixNaming(true)
 *     .sortElements(true)
 *     .build();
 * }</pre>
 *
 * @param removeDuplicates report and collapse names defined more than once
 * @param fixNaming rewrite link and joint names that break the naming convention
 * @param addMissingProperties synthesize inertial blocks for links with geometry but none
 * @param cleanWhitespace regenerate the whole text
 * @param sortElements order links and joints by name
 * @param removeUnusedMaterials delete materials no visual references
 */
public record FixOptions(
    boolean removeDuplicates,
    boolean fixNaming,
    boolean addMissingProperties,
    boolean cleanWhitespace,
    boolean sortElements,
    boolean removeUnusedMaterials
) {
    /**
     * Creates the default selection: remove duplicates, remove unused materials and
     * clean whitespace.
     *
     * @return default fix options
     */
    public static FixOptions defaults() {
        return new FixOptions(true, false, false, true, false, true);
    }

    /**
     * Creates a builder starting from {@link #defaults()}.
     *
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FixOptions.
     */
    public static class Builder {
        private boolean removeDuplicates = true;
        private boolean fixNaming = false;
        private boolean addMissingProperties = false;
        private boolean cleanWhitespace = true;
        private boolean sortElements = false;
        private boolean removeUnusedMaterials = true;

        public Builder removeDuplicates(boolean value) {
            this.removeDuplicates = value;
            return this;
        }

        public Builder fixNaming(boolean value) {
            this.fixNaming = value;
            return this;
        }

        public Builder addMissingProperties(boolean value) {
            this.addMissingProperties = value;
            return this;
        }

        public Builder cleanWhitespace(boolean value) {
            this.cleanWhitespace = value;
            return this;
        }

        public Builder sortElements(boolean value) {
            this.sortElements = value;
            return this;
        }

        public Builder removeUnusedMaterials(boolean value) {
            this.removeUnusedMaterials = value;
            return this;
        }

        public FixOptions build() {
            return new FixOptions(
                removeDuplicates,
                fixNaming,
                addMissingProperties,
                cleanWhitespace,
                sortElements,
                removeUnusedMaterials
            );
        }
    }
}

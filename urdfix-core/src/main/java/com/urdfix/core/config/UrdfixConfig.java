package com.urdfix.core.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.urdfix.core.analyzer.LintSettings;
import com.urdfix.core.generator.FormatOptions;
import com.urdfix.core.modifier.FixOptions;

/**
 * Root configuration loaded from {@code urdfix.yaml}.
 *
 * <p>Every section and every value is optional; anything absent falls back to the
 * defaults of {@link FixOptions}, {@link FormatOptions} and {@link LintSettings}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * fix:
 *   fixNaming: true
 *   sortElements: true
 *
 * format:
 *   indent: "    "
 *   compactEmptyElements: false
 *   maxLineLength: 100
 *
 * lint:
 *   disabled:
 *     - unused-materials
 * }</pre>
 *
 * @param fix fix transform selection
 * @param format output formatting
 * @param lint lint rule selection
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UrdfixConfig(
    @JsonProperty("fix") FixSection fix,
    @JsonProperty("format") FormatSection format,
    @JsonProperty("lint") LintSection lint
) {
    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static UrdfixConfig defaults() {
        return new UrdfixConfig(null, null, null);
    }

    public FixOptions fixOptions() {
        return fix == null ? FixOptions.defaults() : fix.toOptions();
    }

    public FormatOptions formatOptions() {
        return format == null ? FormatOptions.defaults() : format.toOptions();
    }

    public LintSettings lintSettings() {
        return lint == null ? LintSettings.defaults() : lint.toSettings();
    }

    /**
     * Fix transform selection. Null values keep the default.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FixSection(
        @JsonProperty("removeDuplicates") Boolean removeDuplicates,
        @JsonProperty("fixNaming") Boolean fixNaming,
        @JsonProperty("addMissingProperties") Boolean addMissingProperties,
        @JsonProperty("cleanWhitespace") Boolean cleanWhitespace,
        @JsonProperty("sortElements") Boolean sortElements,
        @JsonProperty("removeUnusedMaterials") Boolean removeUnusedMaterials
    ) {
        public FixOptions toOptions() {
            FixOptions defaults = FixOptions.defaults();
            return FixOptions.builder()
                .removeDuplicates(orDefault(removeDuplicates, defaults.removeDuplicates()))
                .fixNaming(orDefault(fixNaming, defaults.fixNaming()))
                .addMissingProperties(orDefault(addMissingProperties, defaults.addMissingProperties()))
                .cleanWhitespace(orDefault(cleanWhitespace, defaults.cleanWhitespace()))
                .sortElements(orDefault(sortElements, defaults.sortElements()))
                .removeUnusedMaterials(orDefault(removeUnusedMaterials, defaults.removeUnusedMaterials()))
                .build();
        }
    }

    /**
     * Output formatting. Null values keep the default.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FormatSection(
        @JsonProperty("indent") String indent,
        @JsonProperty("attributeOrder") List<String> attributeOrder,
        @JsonProperty("elementOrder") List<String> elementOrder,
        @JsonProperty("compactEmptyElements") Boolean compactEmptyElements,
        @JsonProperty("maxLineLength") Integer maxLineLength
    ) {
        public FormatOptions toOptions() {
            FormatOptions defaults = FormatOptions.defaults();
            return new FormatOptions(
                indent,
                attributeOrder,
                elementOrder,
                orDefault(compactEmptyElements, defaults.compactEmptyElements()),
                maxLineLength == null ? defaults.maxLineLength() : maxLineLength
            );
        }
    }

    /**
     * Lint rule selection.
     *
     * @param disabled ids of rules to skip
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LintSection(
        @JsonProperty("disabled") List<String> disabled
    ) {
        public LintSettings toSettings() {
            return disabled == null
                ? LintSettings.defaults()
                : LintSettings.disabling(disabled.toArray(String[]::new));
        }
    }

    private static boolean orDefault(Boolean value, boolean defaultValue) {
        return value == null ? defaultValue : value;
    }
}

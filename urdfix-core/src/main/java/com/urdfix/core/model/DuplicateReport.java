package com.urdfix.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names that were defined more than once in the parsed text.
 *
 * <p>The robot keeps only the last definition of a name, so duplicates can only be
 * observed while parsing. The parser records them here before they collapse.
 *
 * @param duplicates duplicated names per element kind, in order of first repetition
 */
public record DuplicateReport(Map<ElementKind, List<String>> duplicates) {

    public DuplicateReport {
        EnumMap<ElementKind, List<String>> copy = new EnumMap<>(ElementKind.class);
        if (duplicates != null) {
            duplicates.forEach((kind, names) -> {
                if (names != null && !names.isEmpty()) {
                    copy.put(kind, List.copyOf(names));
                }
            });
        }
        duplicates = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a report without duplicates.
     *
     * @return empty report
     */
    public static DuplicateReport none() {
        return new DuplicateReport(Map.of());
    }

    public boolean isEmpty() {
        return duplicates.isEmpty();
    }

    /**
     * Returns the duplicated names of one kind.
     *
     * @param kind element kind
     * @return duplicated names, empty if none
     */
    public List<String> namesFor(ElementKind kind) {
        return duplicates.getOrDefault(kind, List.of());
    }

    /**
     * Collects names while parsing and remembers those seen twice.
     */
    public static class Builder {
        private final Map<ElementKind, Set<String>> seen = new EnumMap<>(ElementKind.class);
        private final Map<ElementKind, Set<String>> repeated = new EnumMap<>(ElementKind.class);

        /**
         * Registers a definition.
         *
         * @param kind element kind
         * @param name defined name
         * @return true if the name had been defined before
         */
        public boolean record(ElementKind kind, String name) {
            if (seen.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(name)) {
                return false;
            }
            repeated.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(name);
            return true;
        }

        public DuplicateReport build() {
            Map<ElementKind, List<String>> result = new EnumMap<>(ElementKind.class);
            repeated.forEach((kind, names) -> result.put(kind, List.copyOf(names)));
            return new DuplicateReport(result);
        }
    }
}

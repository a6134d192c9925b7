package com.github.alvarosanchez.pkgsource.model;

import java.util.List;

/**
 * Decision about which package sources serve queries for the current session.
 *
 * @param kind how the decision was reached
 * @param descriptors sources in query order, never empty for override kinds
 */
public record ResolvedSource(Kind kind, List<PackageSourceDescriptor> descriptors) {

    /**
     * Origin of a resolved source.
     */
    public enum Kind {
        /**
         * A single source passed on the command line.
         */
        SINGLE_OVERRIDE,
        /**
         * Several sources passed on the command line, queried as one.
         */
        COMPOSITE_OVERRIDE,
        /**
         * The source designated by the persisted configuration.
         */
        CONFIGURED
    }

    /**
     * Creates a resolved source.
     *
     * @param kind how the decision was reached
     * @param descriptors sources in query order
     */
    public ResolvedSource {
        if (kind == null) {
            throw new IllegalArgumentException("Resolved source kind is required.");
        }
        descriptors = descriptors == null ? List.of() : List.copyOf(descriptors);
        if (kind == Kind.SINGLE_OVERRIDE && descriptors.size() != 1) {
            throw new IllegalArgumentException("A single override resolves to exactly one source.");
        }
        if (kind == Kind.COMPOSITE_OVERRIDE && descriptors.size() < 2) {
            throw new IllegalArgumentException("A composite override resolves to two or more sources.");
        }
    }
}

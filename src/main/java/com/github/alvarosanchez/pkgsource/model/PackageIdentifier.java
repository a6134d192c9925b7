package com.github.alvarosanchez.pkgsource.model;

import java.util.Locale;

/**
 * Package id with an optional version.
 *
 * @param id package id, compared ignoring case
 * @param version exact version, or {@code null} for any version
 */
public record PackageIdentifier(String id, String version) {

    /**
     * Creates a package identifier.
     *
     * @param id package id
     * @param version exact version, or {@code null}
     */
    public PackageIdentifier {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Package id is required.");
        }
        id = id.trim();
        version = version == null || version.isBlank() ? null : version.trim();
    }

    /**
     * Parses {@code id} or {@code id@version}.
     *
     * @param value identifier text
     * @return parsed identifier
     */
    public static PackageIdentifier parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Package identifier is required.");
        }
        int separator = value.indexOf('@');
        if (separator < 0) {
            return new PackageIdentifier(value, null);
        }
        if (separator == 0) {
            throw new IllegalArgumentException("Malformed package identifier: " + value);
        }
        return new PackageIdentifier(value.substring(0, separator), value.substring(separator + 1));
    }

    /**
     * Returns whether this identifier names the given package id.
     *
     * @param otherId package id
     * @return {@code true} when ids match ignoring case
     */
    public boolean hasId(String otherId) {
        return id.equalsIgnoreCase(otherId);
    }

    /**
     * Returns the case-insensitive key used to group packages.
     *
     * @return lower-cased id
     */
    public String key() {
        return id.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return version == null ? id : id + "@" + version;
    }
}

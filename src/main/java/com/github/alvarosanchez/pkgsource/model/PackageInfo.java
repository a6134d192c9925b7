package com.github.alvarosanchez.pkgsource.model;

/**
 * Package returned by a package source query.
 *
 * @param id package id
 * @param version package version
 * @param description optional description
 * @param sourceName name of the source that returned the package
 */
public record PackageInfo(String id, String version, String description, String sourceName) {

    /**
     * Returns the identifier of this package.
     *
     * @return identifier with an exact version
     */
    public PackageIdentifier identifier() {
        return new PackageIdentifier(id, version);
    }

    /**
     * Returns whether the version carries a pre-release suffix.
     *
     * @return {@code true} for pre-release versions
     */
    public boolean isPrerelease() {
        return PackageVersions.isPrerelease(version);
    }
}

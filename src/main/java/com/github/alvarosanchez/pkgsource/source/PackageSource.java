package com.github.alvarosanchez.pkgsource.source;

import com.github.alvarosanchez.pkgsource.model.PackageIdentifier;
import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Queryable package repository.
 */
public interface PackageSource {

    /**
     * Returns the source name.
     *
     * @return source name
     */
    String name();

    /**
     * Searches packages whose id matches a term. An empty term lists every package.
     *
     * @param searchTerm term to match, never {@code null}
     * @param includePrerelease whether pre-release versions are returned
     * @param numberToGet maximum number of packages to return
     * @param numberToSkip number of packages to skip first
     * @param cancellationToken cooperative cancellation signal
     * @return future completed with matching packages
     */
    CompletableFuture<List<PackageInfo>> searchAsync(
        String searchTerm,
        boolean includePrerelease,
        int numberToGet,
        int numberToSkip,
        CancellationToken cancellationToken
    );

    /**
     * Finds available updates for installed packages.
     *
     * @param installedPackages installed packages with exact versions
     * @param includePrerelease whether pre-release versions are considered
     * @param targetFrameworks comma separated target frameworks, may be empty
     * @param versionConstraints version constraints, may be empty
     * @return packages newer than the installed ones
     */
    List<PackageInfo> getUpdates(
        Collection<PackageIdentifier> installedPackages,
        boolean includePrerelease,
        String targetFrameworks,
        String versionConstraints
    );

    /**
     * Looks up one package.
     *
     * @param identifier package id and optional exact version
     * @return matching package, or empty when the source does not have it
     */
    Optional<PackageInfo> getSpecificPackage(PackageIdentifier identifier);
}

package com.github.alvarosanchez.pkgsource.service;

import com.github.alvarosanchez.pkgsource.model.PackageIdentifier;
import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import com.github.alvarosanchez.pkgsource.source.CancellationToken;
import jakarta.inject.Singleton;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for package queries. Every call goes to the source {@link SourceResolver} marks active, resolving it on
 * first use. Failures of the underlying source reach the caller unchanged.
 */
@Singleton
public class PackageQueryFacade {

    /**
     * Number of packages a search returns when not told otherwise.
     */
    public static final int DEFAULT_SEARCH_TAKE = 15;

    private final SourceResolver sourceResolver;

    PackageQueryFacade(SourceResolver sourceResolver) {
        this.sourceResolver = sourceResolver;
    }

    /**
     * Lists the first page of release packages from all active sources.
     *
     * @return future completed with the packages
     */
    public CompletableFuture<List<PackageInfo>> searchAsync() {
        return searchAsync("", false, DEFAULT_SEARCH_TAKE, 0, CancellationToken.NONE);
    }

    /**
     * Searches release packages matching a term.
     *
     * @param searchTerm term to match, empty for every package
     * @return future completed with the first page of matches
     */
    public CompletableFuture<List<PackageInfo>> searchAsync(String searchTerm) {
        return searchAsync(searchTerm, false, DEFAULT_SEARCH_TAKE, 0, CancellationToken.NONE);
    }

    /**
     * Searches packages matching a term. The cancellation token is passed to the source as is and no timeout is added.
     *
     * @param searchTerm term to match, empty for every package
     * @param includePrerelease whether pre-release versions are returned
     * @param numberToGet maximum number of packages to return
     * @param numberToSkip number of packages to skip first
     * @param cancellationToken cooperative cancellation signal
     * @return future completed with matching packages
     */
    public CompletableFuture<List<PackageInfo>> searchAsync(
        String searchTerm,
        boolean includePrerelease,
        int numberToGet,
        int numberToSkip,
        CancellationToken cancellationToken
    ) {
        return sourceResolver.active().searchAsync(
            searchTerm == null ? "" : searchTerm,
            includePrerelease,
            numberToGet,
            numberToSkip,
            cancellationToken == null ? CancellationToken.NONE : cancellationToken
        );
    }

    /**
     * Finds release updates for installed packages.
     *
     * @param installedPackages installed packages
     * @return available updates
     */
    public List<PackageInfo> getUpdates(Collection<PackageIdentifier> installedPackages) {
        return getUpdates(installedPackages, false, "", "");
    }

    /**
     * Finds updates for installed packages.
     *
     * @param installedPackages installed packages
     * @param includePrerelease whether pre-release versions are considered
     * @param targetFrameworks comma separated target frameworks, may be empty
     * @param versionConstraints version constraints, may be empty
     * @return available updates
     */
    public List<PackageInfo> getUpdates(
        Collection<PackageIdentifier> installedPackages,
        boolean includePrerelease,
        String targetFrameworks,
        String versionConstraints
    ) {
        return sourceResolver.active().getUpdates(
            installedPackages,
            includePrerelease,
            targetFrameworks == null ? "" : targetFrameworks,
            versionConstraints == null ? "" : versionConstraints
        );
    }

    /**
     * Looks up one package.
     *
     * @param identifier package id and optional exact version
     * @return matching package, or empty when no active source has it
     */
    public Optional<PackageInfo> getSpecificPackage(PackageIdentifier identifier) {
        return sourceResolver.active().getSpecificPackage(identifier);
    }
}

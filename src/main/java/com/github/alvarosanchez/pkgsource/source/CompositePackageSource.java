package com.github.alvarosanchez.pkgsource.source;

import com.github.alvarosanchez.pkgsource.model.PackageIdentifier;
import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Package source that fans each query out over several sources, in order.
 */
public final class CompositePackageSource implements PackageSource {

    static final String NAME = "(Aggregate source)";

    private final List<PackageSource> sources;

    /**
     * Creates a composite source.
     *
     * @param sources underlying sources in query order
     */
    public CompositePackageSource(List<? extends PackageSource> sources) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Returns the underlying sources in query order.
     *
     * @return underlying sources
     */
    public List<PackageSource> sources() {
        return sources;
    }

    @Override
    public CompletableFuture<List<PackageInfo>> searchAsync(
        String searchTerm,
        boolean includePrerelease,
        int numberToGet,
        int numberToSkip,
        CancellationToken cancellationToken
    ) {
        List<CompletableFuture<List<PackageInfo>>> searches = new ArrayList<>();
        for (PackageSource source : sources) {
            searches.add(source.searchAsync(searchTerm, includePrerelease, numberToGet, numberToSkip, cancellationToken));
        }

        return CompletableFuture.allOf(searches.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<PackageInfo> packages = new ArrayList<>();
                for (CompletableFuture<List<PackageInfo>> search : searches) {
                    packages.addAll(search.join());
                }
                return packages;
            });
    }

    @Override
    public List<PackageInfo> getUpdates(
        Collection<PackageIdentifier> installedPackages,
        boolean includePrerelease,
        String targetFrameworks,
        String versionConstraints
    ) {
        List<PackageInfo> updates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (PackageSource source : sources) {
            for (PackageInfo update : source.getUpdates(installedPackages, includePrerelease, targetFrameworks, versionConstraints)) {
                if (seen.add(update.identifier().key() + "@" + String.valueOf(update.version()).toLowerCase(Locale.ROOT))) {
                    updates.add(update);
                }
            }
        }
        return updates;
    }

    @Override
    public Optional<PackageInfo> getSpecificPackage(PackageIdentifier identifier) {
        for (PackageSource source : sources) {
            Optional<PackageInfo> found = source.getSpecificPackage(identifier);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}

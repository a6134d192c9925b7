package com.github.alvarosanchez.pkgsource.source;

import com.github.alvarosanchez.pkgsource.model.PackageIdentifier;
import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Stand-in for a source whose protocol has no implementation in this tool. Every query fails.
 */
final class UnsupportedPackageSource implements PackageSource {

    private final PackageSourceDescriptor descriptor;

    UnsupportedPackageSource(PackageSourceDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public CompletableFuture<List<PackageInfo>> searchAsync(
        String searchTerm,
        boolean includePrerelease,
        int numberToGet,
        int numberToSkip,
        CancellationToken cancellationToken
    ) {
        return CompletableFuture.failedFuture(unsupported());
    }

    @Override
    public List<PackageInfo> getUpdates(
        Collection<PackageIdentifier> installedPackages,
        boolean includePrerelease,
        String targetFrameworks,
        String versionConstraints
    ) {
        throw unsupported();
    }

    @Override
    public Optional<PackageInfo> getSpecificPackage(PackageIdentifier identifier) {
        throw unsupported();
    }

    private IllegalStateException unsupported() {
        return new IllegalStateException(
            "Package source `" + descriptor.name() + "` at " + descriptor.location() + " uses an unsupported protocol."
        );
    }
}

package com.github.alvarosanchez.pkgsource.source;

import com.github.alvarosanchez.pkgsource.model.PackageIdentifier;
import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import com.github.alvarosanchez.pkgsource.model.PackageVersions;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Package source backed by a flat directory of {@code <id>.<version>.nupkg} archives.
 * <p>
 * Target frameworks and version constraints are not evaluated; archives carry no such metadata here.
 */
public final class LocalFolderPackageSource implements PackageSource {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFolderPackageSource.class);

    static final String PACKAGE_EXTENSION = ".nupkg";

    private static final Comparator<PackageInfo> SEARCH_ORDER = Comparator
        .comparing((PackageInfo info) -> info.id().toLowerCase(Locale.ROOT))
        .thenComparing(PackageInfo::version, PackageVersions.ORDER.reversed());

    private final String name;
    private final Path directory;
    private final Executor executor;

    /**
     * Creates a local folder source searching on the common pool.
     *
     * @param name source name
     * @param directory directory holding package archives
     */
    public LocalFolderPackageSource(String name, Path directory) {
        this(name, directory, ForkJoinPool.commonPool());
    }

    /**
     * Creates a local folder source.
     *
     * @param name source name
     * @param directory directory holding package archives
     * @param executor executor running searches
     */
    public LocalFolderPackageSource(String name, Path directory, Executor executor) {
        this.name = name;
        this.directory = directory;
        this.executor = executor;
    }

    @Override
    public String name() {
        return name;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public CompletableFuture<List<PackageInfo>> searchAsync(
        String searchTerm,
        boolean includePrerelease,
        int numberToGet,
        int numberToSkip,
        CancellationToken cancellationToken
    ) {
        String term = searchTerm == null ? "" : searchTerm.trim().toLowerCase(Locale.ROOT);
        return CompletableFuture.supplyAsync(() -> {
            List<PackageInfo> matches = new ArrayList<>();
            for (PackageInfo info : listPackages(cancellationToken)) {
                if (!includePrerelease && info.isPrerelease()) {
                    continue;
                }
                if (info.id().toLowerCase(Locale.ROOT).contains(term)) {
                    matches.add(info);
                }
            }
            matches.sort(SEARCH_ORDER);
            return matches.stream()
                .skip(Math.max(0, numberToSkip))
                .limit(Math.max(0, numberToGet))
                .toList();
        }, executor);
    }

    @Override
    public List<PackageInfo> getUpdates(
        Collection<PackageIdentifier> installedPackages,
        boolean includePrerelease,
        String targetFrameworks,
        String versionConstraints
    ) {
        List<PackageInfo> available = listPackages(CancellationToken.NONE);
        List<PackageInfo> updates = new ArrayList<>();
        for (PackageIdentifier installed : installedPackages) {
            PackageInfo newest = null;
            for (PackageInfo candidate : available) {
                if (!installed.hasId(candidate.id()) || (!includePrerelease && candidate.isPrerelease())) {
                    continue;
                }
                if (installed.version() != null && PackageVersions.compare(candidate.version(), installed.version()) <= 0) {
                    continue;
                }
                if (newest == null || PackageVersions.compare(candidate.version(), newest.version()) > 0) {
                    newest = candidate;
                }
            }
            if (newest != null) {
                updates.add(newest);
            }
        }
        return updates;
    }

    @Override
    public Optional<PackageInfo> getSpecificPackage(PackageIdentifier identifier) {
        PackageInfo best = null;
        for (PackageInfo candidate : listPackages(CancellationToken.NONE)) {
            if (!identifier.hasId(candidate.id())) {
                continue;
            }
            if (identifier.version() != null) {
                if (PackageVersions.compare(candidate.version(), identifier.version()) == 0) {
                    return Optional.of(candidate);
                }
                continue;
            }
            if (best == null || PackageVersions.compare(candidate.version(), best.version()) > 0) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private List<PackageInfo> listPackages(CancellationToken cancellationToken) {
        if (!Files.isDirectory(directory)) {
            LOG.debug("Package directory {} of source {} does not exist", directory, name);
            return List.of();
        }
        List<PackageInfo> packages = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                cancellationToken.throwIfCancellationRequested();
                parseFileName(file.getFileName().toString()).ifPresent(packages::add);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list packages in " + directory, e);
        }
        return packages;
    }

    Optional<PackageInfo> parseFileName(String fileName) {
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(PACKAGE_EXTENSION)) {
            return Optional.empty();
        }
        String baseName = fileName.substring(0, fileName.length() - PACKAGE_EXTENSION.length());
        String[] segments = baseName.split("\\.");
        for (int i = 1; i < segments.length; i++) {
            if (!segments[i].isEmpty() && Character.isDigit(segments[i].charAt(0))) {
                String id = String.join(".", List.of(segments).subList(0, i));
                String version = String.join(".", List.of(segments).subList(i, segments.length));
                return Optional.of(new PackageInfo(id, version, null, name));
            }
        }
        return Optional.empty();
    }
}

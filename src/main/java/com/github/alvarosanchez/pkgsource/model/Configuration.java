package com.github.alvarosanchez.pkgsource.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Loaded package source settings.
 * <p>
 * At most one source is designated active. Instances are replaced wholesale on reload and only change through the
 * setters below.
 */
public final class Configuration {

    /**
     * Directory packages are installed into when the file does not say otherwise.
     */
    public static final String DEFAULT_REPOSITORY_PATH = "Packages";

    /**
     * Request timeout used when the file does not say otherwise.
     */
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 10;

    private Path storagePath;
    private boolean verbose;
    private boolean installFromCache = true;
    private String repositoryPath = DEFAULT_REPOSITORY_PATH;
    private int requestTimeoutSeconds = DEFAULT_REQUEST_TIMEOUT_SECONDS;
    private boolean readOnlyPackageFiles;
    private final List<PackageSourceDescriptor> sources = new ArrayList<>();
    private String activeSourceName;

    /**
     * Creates an empty configuration stored at the given path.
     *
     * @param storagePath absolute path of the backing file
     */
    public Configuration(Path storagePath) {
        setStoragePath(storagePath);
    }

    public Path getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(Path storagePath) {
        if (storagePath == null) {
            throw new IllegalArgumentException("Configuration storage path is required.");
        }
        this.storagePath = storagePath.toAbsolutePath().normalize();
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isInstallFromCache() {
        return installFromCache;
    }

    public void setInstallFromCache(boolean installFromCache) {
        this.installFromCache = installFromCache;
    }

    public String getRepositoryPath() {
        return repositoryPath;
    }

    public void setRepositoryPath(String repositoryPath) {
        this.repositoryPath = repositoryPath == null || repositoryPath.isBlank() ? DEFAULT_REPOSITORY_PATH : repositoryPath;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        if (requestTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Request timeout must be positive, got " + requestTimeoutSeconds);
        }
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public boolean isReadOnlyPackageFiles() {
        return readOnlyPackageFiles;
    }

    public void setReadOnlyPackageFiles(boolean readOnlyPackageFiles) {
        this.readOnlyPackageFiles = readOnlyPackageFiles;
    }

    /**
     * Returns configured sources in file order.
     *
     * @return unmodifiable view of the sources
     */
    public List<PackageSourceDescriptor> getSources() {
        return Collections.unmodifiableList(sources);
    }

    /**
     * Returns enabled sources in file order.
     *
     * @return enabled sources
     */
    public List<PackageSourceDescriptor> getEnabledSources() {
        List<PackageSourceDescriptor> enabled = new ArrayList<>();
        for (PackageSourceDescriptor source : sources) {
            if (source.enabled()) {
                enabled.add(source);
            }
        }
        return enabled;
    }

    /**
     * Appends a source.
     *
     * @param source source to add
     */
    public void addSource(PackageSourceDescriptor source) {
        if (findSource(source.name()).isPresent()) {
            throw new IllegalArgumentException("Package source `" + source.name() + "` is already configured.");
        }
        sources.add(source);
    }

    /**
     * Removes a source, clearing the active designation when it pointed at it.
     *
     * @param name source name
     * @return {@code true} when a source was removed
     */
    public boolean removeSource(String name) {
        boolean removed = sources.removeIf(source -> source.name().equals(name));
        if (removed && name.equals(activeSourceName)) {
            activeSourceName = null;
        }
        return removed;
    }

    /**
     * Looks up a source by name.
     *
     * @param name source name
     * @return matching source, if any
     */
    public Optional<PackageSourceDescriptor> findSource(String name) {
        for (PackageSourceDescriptor source : sources) {
            if (source.name().equals(name)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the designated active source.
     *
     * @return active source, or empty when none is designated
     */
    public Optional<PackageSourceDescriptor> getActiveSource() {
        return activeSourceName == null ? Optional.empty() : findSource(activeSourceName);
    }

    public Optional<String> getActiveSourceName() {
        return Optional.ofNullable(activeSourceName);
    }

    /**
     * Designates the active source.
     *
     * @param name source name, or {@code null} to clear the designation
     */
    public void setActiveSourceName(String name) {
        if (name == null || name.isBlank()) {
            activeSourceName = null;
            return;
        }
        if (findSource(name).isEmpty()) {
            throw new IllegalArgumentException("Package source `" + name + "` is not configured.");
        }
        activeSourceName = name;
    }
}

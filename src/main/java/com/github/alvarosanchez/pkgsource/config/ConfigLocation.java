package com.github.alvarosanchez.pkgsource.config;

import com.github.alvarosanchez.pkgsource.prefs.PreferenceStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Path;

/**
 * Where the configuration file currently lives.
 * <p>
 * The directory is relative to the project root and remembered across sessions in the {@link PreferenceStore}.
 */
@Singleton
public class ConfigLocation {

    /**
     * Configuration file name.
     */
    public static final String FILE_NAME = "pkgsource.json";

    /**
     * Suffix of the sidecar metadata file kept next to the configuration file.
     */
    public static final String SIDECAR_SUFFIX = ".meta";

    /**
     * Preference key remembering the configuration directory.
     */
    public static final String DIRECTORY_PREFERENCE_KEY = "ConfigFileDirectoryPath";

    private String directoryPath;
    private Path filePath;

    @Inject
    ConfigLocation(PreferenceStore preferenceStore) {
        this(preferenceStore.getString(DIRECTORY_PREFERENCE_KEY, ""));
    }

    /**
     * Creates a location for a directory relative to the project root.
     *
     * @param directoryPath directory relative to the project root, empty for the root itself
     */
    public ConfigLocation(String directoryPath) {
        setDirectoryPath(directoryPath);
    }

    /**
     * Returns the configuration directory relative to the project root.
     *
     * @return relative directory, empty for the project root
     */
    public String directoryPath() {
        return directoryPath;
    }

    /**
     * Returns the configuration file path relative to the project root.
     *
     * @return relative file path
     */
    public Path filePath() {
        return filePath;
    }

    /**
     * Returns the absolute path of the configuration file.
     *
     * @return absolute file path
     */
    public Path fullPath() {
        return projectRoot().resolve(filePath).toAbsolutePath().normalize();
    }

    /**
     * Returns the absolute path of the sidecar metadata file.
     *
     * @return absolute sidecar path
     */
    public Path sidecarPath() {
        return sidecarOf(fullPath());
    }

    /**
     * Points the in-memory location at another directory. Nothing is moved on disk.
     *
     * @param directoryPath directory relative to the project root
     */
    public void setDirectoryPath(String directoryPath) {
        this.directoryPath = directoryPath == null ? "" : directoryPath.trim();
        this.filePath = Path.of(this.directoryPath, FILE_NAME);
    }

    /**
     * Returns the project root that relative paths are resolved against.
     *
     * @return project root directory
     */
    public Path projectRoot() {
        String configuredPath = System.getProperty("pkgsource.project.dir");
        if (configuredPath != null && !configuredPath.isBlank()) {
            return Path.of(configuredPath);
        }
        return Path.of(System.getProperty("user.dir"));
    }

    /**
     * Returns the sidecar metadata file that belongs to a configuration file.
     *
     * @param file configuration file
     * @return sidecar path next to {@code file}
     */
    public static Path sidecarOf(Path file) {
        return file.resolveSibling(file.getFileName() + SIDECAR_SUFFIX);
    }
}

package com.github.alvarosanchez.pkgsource.config;

import io.micronaut.serde.annotation.Serdeable;
import java.util.List;

/**
 * Root JSON model for the package source configuration file.
 *
 * @param config global options
 * @param packageSources configured package sources in query order
 * @param activePackageSource name of the active source, {@code null} for all enabled sources
 */
@Serdeable
public record PackageSourceConfigFile(
    ConfigOptions config,
    List<PackageSourceEntry> packageSources,
    String activePackageSource
) {

    /**
     * Creates a configuration file model.
     *
     * @param config global options
     * @param packageSources configured package sources
     * @param activePackageSource name of the active source
     */
    public PackageSourceConfigFile {
        config = config == null ? new ConfigOptions() : config;
        packageSources = packageSources == null ? List.of() : List.copyOf(packageSources);
        activePackageSource = activePackageSource == null || activePackageSource.isBlank() ? null : activePackageSource;
    }

    /**
     * Global options.
     *
     * @param verbose enables verbose logging
     * @param installFromCache whether packages may be installed from the local cache
     * @param repositoryPath directory packages are installed into
     * @param requestTimeoutSeconds timeout for source requests
     * @param readOnlyPackageFiles whether installed package files are made read-only
     */
    @Serdeable
    public record ConfigOptions(
        Boolean verbose,
        Boolean installFromCache,
        String repositoryPath,
        Integer requestTimeoutSeconds,
        Boolean readOnlyPackageFiles
    ) {

        /**
         * Creates options where every value falls back to its default.
         */
        public ConfigOptions() {
            this(null, null, null, null, null);
        }
    }

    /**
     * Package source entry.
     *
     * @param name source name
     * @param location URL or path of the source
     * @param username optional user name
     * @param password optional password or API key
     * @param enabled whether the source is enabled, {@code null} meaning enabled
     */
    @Serdeable
    public record PackageSourceEntry(String name, String location, String username, String password, Boolean enabled) {

        /**
         * Creates an enabled entry without credentials.
         *
         * @param name source name
         * @param location URL or path of the source
         */
        public PackageSourceEntry(String name, String location) {
            this(name, location, null, null, null);
        }
    }
}

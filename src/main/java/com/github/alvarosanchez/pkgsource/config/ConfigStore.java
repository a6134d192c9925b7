package com.github.alvarosanchez.pkgsource.config;

import com.github.alvarosanchez.pkgsource.config.PackageSourceConfigFile.ConfigOptions;
import com.github.alvarosanchez.pkgsource.config.PackageSourceConfigFile.PackageSourceEntry;
import com.github.alvarosanchez.pkgsource.model.Configuration;
import com.github.alvarosanchez.pkgsource.model.PackageSourceCredentials;
import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the package source configuration file.
 */
@Singleton
public class ConfigStore {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigStore.class);

    /**
     * Name of the source present in a freshly created configuration.
     */
    public static final String DEFAULT_SOURCE_NAME = "nuget.org";

    /**
     * Location of the source present in a freshly created configuration.
     */
    public static final String DEFAULT_SOURCE_LOCATION = "https://api.nuget.org/v3/index.json";

    private final ObjectMapper objectMapper;

    /**
     * Creates a configuration store.
     *
     * @param objectMapper mapper used for the JSON file format
     */
    public ConfigStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the configuration at a path, creating and saving the default one when the file does not exist.
     *
     * @param fullPath absolute path of the configuration file
     * @return loaded or newly created configuration
     * @throws UncheckedIOException when the file cannot be read or parsed
     */
    public Configuration loadOrCreate(Path fullPath) {
        if (Files.exists(fullPath)) {
            return load(fullPath);
        }

        LOG.info("No configuration file found. Creating default at {}", fullPath);
        Configuration configuration = createDefault(fullPath);
        save(configuration);
        return configuration;
    }

    /**
     * Writes a configuration to its storage path.
     *
     * @param configuration configuration to write
     */
    public void save(Configuration configuration) {
        Path file = configuration.getStoragePath();
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, objectMapper.writeValueAsString(toFile(configuration)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write configuration file " + file, e);
        }
    }

    /**
     * Builds the configuration a new project starts with.
     *
     * @param fullPath absolute path the configuration will be stored at
     * @return default configuration
     */
    public static Configuration createDefault(Path fullPath) {
        Configuration configuration = new Configuration(fullPath);
        configuration.addSource(new PackageSourceDescriptor(DEFAULT_SOURCE_NAME, DEFAULT_SOURCE_LOCATION));
        configuration.setActiveSourceName(DEFAULT_SOURCE_NAME);
        return configuration;
    }

    private Configuration load(Path fullPath) {
        PackageSourceConfigFile file;
        try {
            file = objectMapper.readValue(Files.readString(fullPath), PackageSourceConfigFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration file " + fullPath, e);
        }
        if (file == null) {
            throw new UncheckedIOException("Failed to read configuration file " + fullPath, new IOException("File is empty"));
        }
        try {
            return toConfiguration(fullPath, file);
        } catch (IllegalArgumentException e) {
            throw new UncheckedIOException("Invalid configuration file " + fullPath, new IOException(e.getMessage(), e));
        }
    }

    private Configuration toConfiguration(Path fullPath, PackageSourceConfigFile file) {
        Configuration configuration = new Configuration(fullPath);
        ConfigOptions options = file.config();
        configuration.setVerbose(Boolean.TRUE.equals(options.verbose()));
        configuration.setInstallFromCache(!Boolean.FALSE.equals(options.installFromCache()));
        configuration.setRepositoryPath(options.repositoryPath());
        if (options.requestTimeoutSeconds() != null) {
            configuration.setRequestTimeoutSeconds(options.requestTimeoutSeconds());
        }
        configuration.setReadOnlyPackageFiles(Boolean.TRUE.equals(options.readOnlyPackageFiles()));

        for (PackageSourceEntry entry : file.packageSources()) {
            PackageSourceCredentials credentials = entry.username() == null && entry.password() == null
                ? null
                : new PackageSourceCredentials(entry.username(), entry.password());
            configuration.addSource(
                new PackageSourceDescriptor(entry.name(), entry.location(), credentials, !Boolean.FALSE.equals(entry.enabled()))
            );
        }

        String active = file.activePackageSource();
        if (active != null) {
            if (configuration.findSource(active).isPresent()) {
                configuration.setActiveSourceName(active);
            } else {
                LOG.warn("Active package source `{}` in {} is not configured; using all enabled sources", active, fullPath);
            }
        }
        return configuration;
    }

    private PackageSourceConfigFile toFile(Configuration configuration) {
        List<PackageSourceEntry> entries = new ArrayList<>();
        for (PackageSourceDescriptor source : configuration.getSources()) {
            PackageSourceCredentials credentials = source.credentials();
            entries.add(
                new PackageSourceEntry(
                    source.name(),
                    source.location(),
                    credentials == null ? null : credentials.username(),
                    credentials == null ? null : credentials.password(),
                    source.enabled() ? null : Boolean.FALSE
                )
            );
        }
        ConfigOptions options = new ConfigOptions(
            configuration.isVerbose(),
            configuration.isInstallFromCache(),
            configuration.getRepositoryPath(),
            configuration.getRequestTimeoutSeconds(),
            configuration.isReadOnlyPackageFiles()
        );
        return new PackageSourceConfigFile(options, entries, configuration.getActiveSourceName().orElse(null));
    }
}

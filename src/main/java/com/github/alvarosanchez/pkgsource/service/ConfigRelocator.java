package com.github.alvarosanchez.pkgsource.service;

import com.github.alvarosanchez.pkgsource.config.ConfigLocation;
import com.github.alvarosanchez.pkgsource.prefs.PreferenceStore;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the configuration file, and its sidecar metadata file, to another directory.
 * <p>
 * After {@link #move(String)} returns, the in-memory location, the remembered preference and the file on disk all
 * point at the same place: the new directory on success, the old one on failure.
 */
@Singleton
public class ConfigRelocator {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigRelocator.class);

    private final ConfigLocation configLocation;
    private final PreferenceStore preferenceStore;
    private final SourceResolver sourceResolver;
    private final HostNotifier hostNotifier;

    ConfigRelocator(
        ConfigLocation configLocation,
        PreferenceStore preferenceStore,
        SourceResolver sourceResolver,
        HostNotifier hostNotifier
    ) {
        this.configLocation = configLocation;
        this.preferenceStore = preferenceStore;
        this.sourceResolver = sourceResolver;
        this.hostNotifier = hostNotifier;
    }

    /**
     * Moves the configuration file to a directory relative to the project root.
     * <p>
     * When no configuration file exists yet, nothing is moved and the configuration is loaded, or created, at the new
     * location.
     *
     * @param newDirectory target directory relative to the project root
     * @return {@code true} when the configuration now lives in {@code newDirectory}
     */
    public boolean move(String newDirectory) {
        RelocationState previous = new RelocationState(
            configLocation.directoryPath(),
            configLocation.filePath(),
            configLocation.fullPath()
        );

        // location and preference change before any file does
        configLocation.setDirectoryPath(newDirectory);
        Path target = configLocation.fullPath();
        try {
            preferenceStore.setString(ConfigLocation.DIRECTORY_PREFERENCE_KEY, configLocation.directoryPath());
        } catch (RuntimeException e) {
            LOG.error("Failed to remember configuration directory {}", newDirectory, e);
            rollback(previous);
            return false;
        }
        LOG.info("Moving configuration file {} to {}", previous.fullPath(), target);

        if (!Files.exists(previous.fullPath())) {
            try {
                sourceResolver.reload();
            } catch (RuntimeException e) {
                LOG.error("Failed to load configuration file at {}", target, e);
                rollback(previous);
                return false;
            }
            notifyAssetsChanged(target);
            return true;
        }
        if (previous.fullPath().equals(target)) {
            return true;
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.move(previous.fullPath(), target);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to move configuration file {} to {}", previous.fullPath(), target, e);
            rollback(previous);
            return false;
        }

        sourceResolver.currentConfiguration().ifPresent(configuration -> configuration.setStoragePath(target));
        moveSidecar(previous.fullPath());
        notifyAssetsChanged(target);
        return true;
    }

    private void moveSidecar(Path previousFile) {
        Path previousSidecar = ConfigLocation.sidecarOf(previousFile);
        if (!Files.exists(previousSidecar)) {
            return;
        }
        try {
            Files.move(previousSidecar, configLocation.sidecarPath());
        } catch (IOException e) {
            LOG.warn("Configuration file moved but its metadata file {} could not follow", previousSidecar, e);
        }
    }

    private void rollback(RelocationState previous) {
        configLocation.setDirectoryPath(previous.directoryPath());
        try {
            preferenceStore.setString(ConfigLocation.DIRECTORY_PREFERENCE_KEY, previous.directoryPath());
        } catch (RuntimeException e) {
            LOG.error("Failed to restore remembered configuration directory {}", previous.directoryPath(), e);
        }
    }

    private void notifyAssetsChanged(Path configurationFile) {
        try {
            hostNotifier.assetsChanged(configurationFile);
        } catch (RuntimeException e) {
            LOG.warn("Asset change notification failed", e);
        }
    }

    private record RelocationState(String directoryPath, Path filePath, Path fullPath) {
    }
}

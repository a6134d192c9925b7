package com.github.alvarosanchez.pkgsource.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigurationTest {

    private Configuration configuration;

    @BeforeEach
    void setUp() {
        configuration = new Configuration(Path.of("project", "..", "project", "pkgsource.json"));
        configuration.addSource(new PackageSourceDescriptor("public", "https://example.org/v3/index.json"));
        configuration.addSource(new PackageSourceDescriptor("local", "packages", null, false));
    }

    @Test
    void storagePathIsAbsoluteAndNormalized() {
        assertTrue(configuration.getStoragePath().isAbsolute());
        assertEquals(Path.of("project", "pkgsource.json").toAbsolutePath(), configuration.getStoragePath());
    }

    @Test
    void defaultsApplyToNewConfiguration() {
        assertTrue(configuration.isInstallFromCache());
        assertFalse(configuration.isVerbose());
        assertEquals(Configuration.DEFAULT_REPOSITORY_PATH, configuration.getRepositoryPath());
        assertEquals(Configuration.DEFAULT_REQUEST_TIMEOUT_SECONDS, configuration.getRequestTimeoutSeconds());
        assertTrue(configuration.getActiveSource().isEmpty());
    }

    @Test
    void enabledSourcesKeepFileOrder() {
        configuration.addSource(new PackageSourceDescriptor("mirror", "https://mirror.example.org/v3/index.json"));

        assertEquals(
            List.of("public", "mirror"),
            configuration.getEnabledSources().stream().map(PackageSourceDescriptor::name).toList()
        );
    }

    @Test
    void duplicateSourceNamesAreRejected() {
        assertThrows(
            IllegalArgumentException.class,
            () -> configuration.addSource(new PackageSourceDescriptor("public", "https://other.example.org"))
        );
    }

    @Test
    void activeSourceMustBeConfigured() {
        configuration.setActiveSourceName("local");
        assertEquals("local", configuration.getActiveSource().orElseThrow().name());

        assertThrows(IllegalArgumentException.class, () -> configuration.setActiveSourceName("missing"));

        configuration.setActiveSourceName(" ");
        assertTrue(configuration.getActiveSourceName().isEmpty());
    }

    @Test
    void removingTheActiveSourceClearsTheDesignation() {
        configuration.setActiveSourceName("public");

        assertTrue(configuration.removeSource("public"));
        assertFalse(configuration.removeSource("public"));
        assertTrue(configuration.getActiveSourceName().isEmpty());
    }

    @Test
    void requestTimeoutMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> configuration.setRequestTimeoutSeconds(0));
    }
}

package com.github.alvarosanchez.pkgsource.prefs;

import io.micronaut.core.type.Argument;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Preference store persisted as a JSON object in the user's configuration directory.
 */
@Singleton
public class FilePreferenceStore implements PreferenceStore {

    static final String PREFERENCES_FILE_NAME = "preferences.json";

    private final ObjectMapper objectMapper;

    FilePreferenceStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String getString(String key, String defaultValue) {
        String value = read().get(key);
        return value == null ? defaultValue : value;
    }

    @Override
    public void setString(String key, String value) {
        Map<String, String> preferences = read();
        if (value == null) {
            preferences.remove(key);
        } else {
            preferences.put(key, value);
        }
        write(preferences);
    }

    private Map<String, String> read() {
        Path file = preferencesFile();
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            Map<String, String> stored = objectMapper.readValue(
                Files.readString(file),
                Argument.mapOf(String.class, String.class)
            );
            return stored == null ? new TreeMap<>() : new TreeMap<>(stored);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read preferences from " + file, e);
        }
    }

    private void write(Map<String, String> preferences) {
        Path file = preferencesFile();
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, objectMapper.writeValueAsString(preferences));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write preferences to " + file, e);
        }
    }

    Path preferencesFile() {
        return preferencesDirectory().resolve(PREFERENCES_FILE_NAME);
    }

    private Path preferencesDirectory() {
        String configuredPath = System.getProperty("pkgsource.prefs.dir");
        if (configuredPath != null && !configuredPath.isBlank()) {
            return Path.of(configuredPath);
        }
        return Path.of(System.getProperty("user.home"), ".config", "pkgsource");
    }
}

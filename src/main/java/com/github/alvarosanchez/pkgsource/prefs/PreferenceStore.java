package com.github.alvarosanchez.pkgsource.prefs;

/**
 * Host key to string store that outlives the process.
 */
public interface PreferenceStore {

    /**
     * Reads a preference.
     *
     * @param key preference key
     * @param defaultValue value returned when the key is not set
     * @return stored value, or {@code defaultValue}
     */
    String getString(String key, String defaultValue);

    /**
     * Writes a preference.
     *
     * @param key preference key
     * @param value value to store
     */
    void setString(String key, String value);
}

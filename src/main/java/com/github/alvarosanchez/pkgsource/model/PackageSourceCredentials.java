package com.github.alvarosanchez.pkgsource.model;

/**
 * Credentials used to authenticate against a package source.
 *
 * @param username user name
 * @param password password or API key
 */
public record PackageSourceCredentials(String username, String password) {

    /**
     * Creates credentials, normalizing blank values to {@code null}.
     *
     * @param username user name
     * @param password password or API key
     */
    public PackageSourceCredentials {
        username = username == null || username.isBlank() ? null : username;
        password = password == null || password.isBlank() ? null : password;
    }

    @Override
    public String toString() {
        return "PackageSourceCredentials[username=" + username + ", password=" + (password == null ? "null" : "****") + "]";
    }
}

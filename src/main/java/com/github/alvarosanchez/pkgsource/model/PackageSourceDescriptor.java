package com.github.alvarosanchez.pkgsource.model;

/**
 * Named reference to a package repository.
 *
 * @param name source name, unique within a configuration
 * @param location URL or filesystem path of the repository
 * @param credentials optional credentials, {@code null} when anonymous
 * @param enabled whether the source takes part in the aggregate source
 */
public record PackageSourceDescriptor(String name, String location, PackageSourceCredentials credentials, boolean enabled) {

    private static final String COMMAND_LINE_PREFIX = "CMD_LINE_SRC_";

    /**
     * Creates a descriptor.
     *
     * @param name source name
     * @param location URL or filesystem path of the repository
     * @param credentials optional credentials
     * @param enabled whether the source is enabled
     */
    public PackageSourceDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Package source name is required.");
        }
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Package source `" + name + "` has no location.");
        }
        name = name.trim();
        location = location.trim();
    }

    /**
     * Creates an enabled descriptor without credentials.
     *
     * @param name source name
     * @param location URL or filesystem path of the repository
     */
    public PackageSourceDescriptor(String name, String location) {
        this(name, location, null, true);
    }

    /**
     * Creates the synthetic descriptor for a source passed on the command line.
     *
     * @param index zero-based position among command line sources
     * @param location URL or filesystem path of the repository
     * @return descriptor named {@code CMD_LINE_SRC_<index>}
     */
    public static PackageSourceDescriptor fromCommandLine(int index, String location) {
        return new PackageSourceDescriptor(COMMAND_LINE_PREFIX + index, location);
    }
}

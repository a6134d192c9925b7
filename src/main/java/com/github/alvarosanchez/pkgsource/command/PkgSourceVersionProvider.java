package com.github.alvarosanchez.pkgsource.command;

import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import picocli.CommandLine.IVersionProvider;

/**
 * Reports the application name and the project version written into {@code application.properties} at build time.
 */
@Singleton
public final class PkgSourceVersionProvider implements IVersionProvider {

    private final String applicationName;
    private final String version;

    PkgSourceVersionProvider(
        @Value("${micronaut.application.name}") String applicationName,
        @Value("${pkgsource.version}") String version
    ) {
        this.applicationName = applicationName;
        this.version = version;
    }

    @Override
    public String[] getVersion() {
        return new String[] {applicationName + " " + version};
    }
}

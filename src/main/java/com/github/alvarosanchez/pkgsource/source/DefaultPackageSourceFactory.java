package com.github.alvarosanchez.pkgsource.source;

import com.github.alvarosanchez.pkgsource.config.ConfigLocation;
import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import jakarta.inject.Singleton;
import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Creates local folder sources for paths and {@code file:} URIs.
 * <p>
 * Other schemes map to {@link UnsupportedPackageSource}, which fails on query.
 */
@Singleton
public class DefaultPackageSourceFactory implements PackageSourceFactory {

    // a single letter before the colon is a Windows drive, not a scheme
    private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]+:");

    private final ConfigLocation configLocation;

    DefaultPackageSourceFactory(ConfigLocation configLocation) {
        this.configLocation = configLocation;
    }

    @Override
    public PackageSource create(PackageSourceDescriptor descriptor) {
        String location = descriptor.location();
        if (location.toLowerCase(Locale.ROOT).startsWith("file:")) {
            return new LocalFolderPackageSource(descriptor.name(), Path.of(URI.create(location)));
        }
        if (URI_SCHEME.matcher(location).find()) {
            return new UnsupportedPackageSource(descriptor);
        }
        return new LocalFolderPackageSource(descriptor.name(), configLocation.projectRoot().resolve(location).normalize());
    }
}

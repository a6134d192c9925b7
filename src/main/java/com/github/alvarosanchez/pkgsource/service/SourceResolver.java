package com.github.alvarosanchez.pkgsource.service;

import com.github.alvarosanchez.pkgsource.config.ConfigLocation;
import com.github.alvarosanchez.pkgsource.config.ConfigStore;
import com.github.alvarosanchez.pkgsource.model.Configuration;
import com.github.alvarosanchez.pkgsource.model.InvocationArguments;
import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import com.github.alvarosanchez.pkgsource.model.ResolvedSource;
import com.github.alvarosanchez.pkgsource.model.ResolvedSource.Kind;
import com.github.alvarosanchez.pkgsource.source.PackageSource;
import com.github.alvarosanchez.pkgsource.source.PackageSourceFactory;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which package source serves queries and caches that decision for the session.
 * <p>
 * The resolver is either unresolved or resolved. The first read resolves it; {@link #reload()} resolves it again and
 * {@link #invalidate()} forgets the decision. It is owned by one coordinating thread: concurrent {@code reload} or
 * {@code invalidate} calls are undefined behavior.
 */
@Singleton
public class SourceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(SourceResolver.class);

    private final ConfigStore configStore;
    private final ConfigLocation configLocation;
    private final CommandLineOverrideScanner overrideScanner;
    private final InvocationArguments invocationArguments;
    private final PackageSourceFactory packageSourceFactory;
    private final HostNotifier hostNotifier;

    private State state = Unresolved.INSTANCE;
    private ResolvedSource lastNotified;

    SourceResolver(
        ConfigStore configStore,
        ConfigLocation configLocation,
        CommandLineOverrideScanner overrideScanner,
        @Nullable InvocationArguments invocationArguments,
        PackageSourceFactory packageSourceFactory,
        HostNotifier hostNotifier
    ) {
        this.configStore = configStore;
        this.configLocation = configLocation;
        this.overrideScanner = overrideScanner;
        this.invocationArguments = invocationArguments == null ? InvocationArguments.none() : invocationArguments;
        this.packageSourceFactory = packageSourceFactory;
        this.hostNotifier = hostNotifier;
    }

    /**
     * Returns the package source queries go to, resolving it first when needed.
     *
     * @return active package source
     */
    public PackageSource active() {
        return resolved().packageSource();
    }

    /**
     * Returns the decision behind {@link #active()}, resolving it first when needed.
     *
     * @return resolved source
     */
    public ResolvedSource resolvedSource() {
        return resolved().resolvedSource();
    }

    /**
     * Returns the loaded configuration, resolving first when needed.
     *
     * @return loaded configuration
     */
    public Configuration configuration() {
        return resolved().configuration();
    }

    /**
     * Returns the loaded configuration without triggering a load.
     *
     * @return loaded configuration, or empty while unresolved
     */
    public Optional<Configuration> currentConfiguration() {
        if (state instanceof Resolved resolved) {
            return Optional.of(resolved.configuration());
        }
        return Optional.empty();
    }

    /**
     * Returns whether a decision is cached.
     *
     * @return {@code true} between a resolution and the next {@link #invalidate()}
     */
    public boolean isResolved() {
        return state instanceof Resolved;
    }

    /**
     * Loads the configuration, scans the invocation arguments and resolves the active source again.
     *
     * @return resolved source
     * @throws java.io.UncheckedIOException when the configuration file cannot be read
     */
    public ResolvedSource reload() {
        Configuration configuration = configStore.loadOrCreate(configLocation.fullPath());
        List<PackageSourceDescriptor> overrides = overrideScanner.scan(invocationArguments.values());
        ResolvedSource resolvedSource = resolve(configuration, overrides);
        PackageSource packageSource = packageSourceFactory.create(resolvedSource.descriptors());
        state = new Resolved(configuration, resolvedSource, packageSource);

        if (!resolvedSource.equals(lastNotified)) {
            lastNotified = resolvedSource;
            notifySourcesChanged(resolvedSource);
        }
        return resolvedSource;
    }

    /**
     * Forgets the cached decision; the next read resolves again.
     */
    public void invalidate() {
        state = Unresolved.INSTANCE;
    }

    /**
     * Writes the loaded configuration back to disk and resolves again from it.
     */
    public void saveConfiguration() {
        configStore.save(configuration());
        reload();
    }

    /**
     * Combines a configuration and command line overrides into one decision.
     * <p>
     * Overrides win unconditionally. Any override switches installing from the cache off on the configuration.
     *
     * @param configuration loaded configuration
     * @param overrides sources forced on the command line, in scan order
     * @return resolved source
     */
    public ResolvedSource resolve(Configuration configuration, List<PackageSourceDescriptor> overrides) {
        if (!overrides.isEmpty()) {
            configuration.setInstallFromCache(false);
        }

        ResolvedSource resolvedSource;
        if (overrides.size() == 1) {
            resolvedSource = new ResolvedSource(Kind.SINGLE_OVERRIDE, overrides);
        } else if (overrides.size() > 1) {
            resolvedSource = new ResolvedSource(Kind.COMPOSITE_OVERRIDE, overrides);
        } else {
            resolvedSource = new ResolvedSource(
                Kind.CONFIGURED,
                configuration.getActiveSource().map(List::of).orElseGet(configuration::getEnabledSources)
            );
        }

        logVerbose(configuration, "Resolved {} package source(s) {}", resolvedSource.kind(), resolvedSource.descriptors());
        return resolvedSource;
    }

    private Resolved resolved() {
        if (!(state instanceof Resolved)) {
            reload();
        }
        return (Resolved) state;
    }

    private void notifySourcesChanged(ResolvedSource resolvedSource) {
        try {
            hostNotifier.sourcesChanged(resolvedSource);
        } catch (RuntimeException e) {
            LOG.warn("Source change notification failed", e);
        }
    }

    private static void logVerbose(Configuration configuration, String format, Object... arguments) {
        if (configuration.isVerbose()) {
            LOG.info(format, arguments);
        } else {
            LOG.debug(format, arguments);
        }
    }

    private interface State {
    }

    private enum Unresolved implements State {
        INSTANCE
    }

    private record Resolved(Configuration configuration, ResolvedSource resolvedSource, PackageSource packageSource)
        implements State {
    }
}

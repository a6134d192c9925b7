package com.github.alvarosanchez.pkgsource.service;

import com.github.alvarosanchez.pkgsource.model.ResolvedSource;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host notifier for a command line host, which has no plugins or asset database to refresh.
 */
@Singleton
public class LoggingHostNotifier implements HostNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingHostNotifier.class);

    @Override
    public void sourcesChanged(ResolvedSource resolvedSource) {
        LOG.debug("Active package source changed to {} {}", resolvedSource.kind(), resolvedSource.descriptors());
    }

    @Override
    public void assetsChanged(Path configurationFile) {
        LOG.debug("Configuration files changed at {}", configurationFile);
    }
}

package com.github.alvarosanchez.pkgsource.service;

import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts package sources forced on the command line with {@code -Source <location>...}.
 */
@Singleton
public final class CommandLineOverrideScanner {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineOverrideScanner.class);

    /**
     * Flag introducing source locations, matched ignoring case.
     */
    public static final String SOURCE_MARKER = "-Source";

    private static final String FLAG_PREFIX = "-";

    private enum State {
        IDLE,
        COLLECTING
    }

    /**
     * Scans argument tokens for source overrides.
     *
     * @param args argument tokens in order
     * @return synthetic descriptors in first-seen order, empty when there are no overrides
     */
    public List<PackageSourceDescriptor> scan(List<String> args) {
        List<PackageSourceDescriptor> sources = new ArrayList<>();
        State state = State.IDLE;
        for (String arg : args) {
            if (arg.startsWith(FLAG_PREFIX)) {
                state = arg.equalsIgnoreCase(SOURCE_MARKER) ? State.COLLECTING : State.IDLE;
                continue;
            }
            if (state == State.COLLECTING && !arg.isBlank()) {
                PackageSourceDescriptor source = PackageSourceDescriptor.fromCommandLine(sources.size(), arg);
                LOG.debug("Adding command line package source {} at {}", source.name(), arg);
                sources.add(source);
            }
        }
        return sources;
    }
}

package com.github.alvarosanchez.pkgsource.source;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation signal observed by package sources.
 */
public interface CancellationToken {

    /**
     * Token that is never cancelled.
     */
    CancellationToken NONE = () -> false;

    /**
     * Returns whether cancellation was requested.
     *
     * @return {@code true} once cancelled
     */
    boolean isCancellationRequested();

    /**
     * Throws when cancellation was requested.
     *
     * @throws CancellationException when cancelled
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Operation was cancelled.");
        }
    }
}

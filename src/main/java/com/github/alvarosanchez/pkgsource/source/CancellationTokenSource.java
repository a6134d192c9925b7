package com.github.alvarosanchez.pkgsource.source;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Issues a {@link CancellationToken} and cancels it.
 */
public final class CancellationTokenSource {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CancellationToken token = cancelled::get;

    public CancellationToken token() {
        return token;
    }

    /**
     * Requests cancellation; later calls have no effect.
     */
    public void cancel() {
        cancelled.set(true);
    }
}

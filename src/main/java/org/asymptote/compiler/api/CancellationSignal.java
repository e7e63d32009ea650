package org.asymptote.compiler.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one request. The caller may flip it from any
 * thread; every pipeline stage polls it at its checkpoints.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Requests cancellation. Idempotent.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

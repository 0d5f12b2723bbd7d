package com.leaksentinel.core.pipeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked at stage boundaries.
 *
 * @since 1.0.0
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Analysis cancelled");
        }
    }
}

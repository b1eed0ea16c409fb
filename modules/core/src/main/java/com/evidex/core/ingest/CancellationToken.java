package com.evidex.core.ingest;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by workers between items.
 * Items already in flight always finish.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

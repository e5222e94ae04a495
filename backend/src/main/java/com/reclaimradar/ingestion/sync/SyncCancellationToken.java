package com.reclaimradar.ingestion.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a sync run, checked between steps. A step already running is not interrupted.
 */
public final class SyncCancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

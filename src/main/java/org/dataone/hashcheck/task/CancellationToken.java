package org.dataone.hashcheck.task;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared cancellation flag of one task. Workers check it between files, never in the middle of
 * reading one.
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

package com.entity.blocking.blocking;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for long emission passes.
 * Checked at each progress checkpoint; may be cancelled from any thread.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

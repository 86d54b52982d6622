package com.entity.blocking.blocking;

import java.time.Duration;

/**
 * Callback for tracking progress of a block key emission pass.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called at every progress checkpoint.
     *
     * @param recordsProcessed number of records pushed through the predicates so far
     * @param elapsed          wall time since emission started
     */
    void onProgress(long recordsProcessed, Duration elapsed);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (recordsProcessed, elapsed) -> {};
}

package com.entity.blocking.metrics;

import com.entity.blocking.index.IndexKey;

import java.time.Duration;

/**
 * Interface for recording blocking metrics.
 * Implementations can integrate with Micrometer or other metrics systems.
 * The default {@link NoOpBlockingMetrics} does nothing.
 */
public interface BlockingMetrics {

    void incrementRecordsBlocked();

    void incrementKeysEmitted(int count);

    void recordIndexBuild(IndexKey key, int documents, Duration duration);

    void recordBlockSize(long size);

    void recordRecall(double recall);
}

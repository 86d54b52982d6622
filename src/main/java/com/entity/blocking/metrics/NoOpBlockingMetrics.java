package com.entity.blocking.metrics;

import com.entity.blocking.index.IndexKey;

import java.time.Duration;

/**
 * No-op implementation of {@link BlockingMetrics}.
 */
public class NoOpBlockingMetrics implements BlockingMetrics {

    public static final NoOpBlockingMetrics INSTANCE = new NoOpBlockingMetrics();

    @Override
    public void incrementRecordsBlocked() {
    }

    @Override
    public void incrementKeysEmitted(int count) {
    }

    @Override
    public void recordIndexBuild(IndexKey key, int documents, Duration duration) {
    }

    @Override
    public void recordBlockSize(long size) {
    }

    @Override
    public void recordRecall(double recall) {
    }
}

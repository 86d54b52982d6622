package com.entity.blocking.blocking;

/**
 * Options for a blocking run: progress cadence, diagnostics output size,
 * and index construction parallelism.
 */
public class BlockingOptions {

    private static final int DEFAULT_PROGRESS_INTERVAL = 10_000;
    private static final int DEFAULT_SHOW_LARGEST_BLOCKS = 10;
    private static final int DEFAULT_INDEX_BUILD_PARALLELISM = 1;

    private final int progressInterval;
    private final int showLargestBlocks;
    private final int indexBuildParallelism;

    private BlockingOptions(Builder builder) {
        this.progressInterval = builder.progressInterval;
        this.showLargestBlocks = builder.showLargestBlocks;
        this.indexBuildParallelism = builder.indexBuildParallelism;
    }

    /**
     * Number of records between progress reports and cancellation checks.
     */
    public int getProgressInterval() {
        return progressInterval;
    }

    /**
     * Number of largest blocks listed in size reports.
     */
    public int getShowLargestBlocks() {
        return showLargestBlocks;
    }

    /**
     * Maximum number of fields whose indices are built concurrently.
     */
    public int getIndexBuildParallelism() {
        return indexBuildParallelism;
    }

    public static BlockingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;
        private int showLargestBlocks = DEFAULT_SHOW_LARGEST_BLOCKS;
        private int indexBuildParallelism = DEFAULT_INDEX_BUILD_PARALLELISM;

        public Builder progressInterval(int progressInterval) {
            if (progressInterval <= 0) {
                throw new IllegalArgumentException("progressInterval must be positive");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder showLargestBlocks(int showLargestBlocks) {
            if (showLargestBlocks < 0) {
                throw new IllegalArgumentException("showLargestBlocks must not be negative");
            }
            this.showLargestBlocks = showLargestBlocks;
            return this;
        }

        public Builder indexBuildParallelism(int indexBuildParallelism) {
            if (indexBuildParallelism <= 0) {
                throw new IllegalArgumentException("indexBuildParallelism must be positive");
            }
            this.indexBuildParallelism = indexBuildParallelism;
            return this;
        }

        public BlockingOptions build() {
            return new BlockingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "BlockingOptions{" +
                "progressInterval=" + progressInterval +
                ", showLargestBlocks=" + showLargestBlocks +
                ", indexBuildParallelism=" + indexBuildParallelism +
                '}';
    }
}

package com.property.distress.ingest;

/**
 * Batch and progress settings for loaders.
 */
public class IngestionOptions {

    private static final int DEFAULT_BATCH_SIZE = 1_000;
    private static final int DEFAULT_PROGRESS_INTERVAL = 500;

    private final int batchSize;
    private final int progressInterval;

    private IngestionOptions(Builder builder) {
        this.batchSize = builder.batchSize;
        this.progressInterval = builder.progressInterval;
    }

    /**
     * Records committed per transaction.
     */
    public int getBatchSize() {
        return batchSize;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public static IngestionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public IngestionOptions build() {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be > 0");
            }
            if (progressInterval <= 0) {
                throw new IllegalArgumentException("progressInterval must be > 0");
            }
            return new IngestionOptions(this);
        }
    }
}

package com.property.distress.ingest;

/**
 * Receives progress notifications during a load.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed rows handled so far
     * @param total     rows in the batch after consolidation
     * @param message   short human-readable status
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}

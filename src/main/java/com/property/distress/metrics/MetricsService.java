package com.property.distress.metrics;

import com.property.distress.core.model.MatchTier;
import com.property.distress.core.model.RecordType;
import com.property.distress.store.SaveOutcome;

import java.time.Duration;

/**
 * Records ingestion, resolution and scoring metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without a registry.
 */
public interface MetricsService {

    /**
     * Counts ingestion rows by outcome (matched, unmatched, skipped, failed) and times the run.
     */
    void recordIngestion(String source, long matched, long unmatched, long skipped, long failed,
                         Duration duration);

    void recordBatchCommit(RecordType type, int size);

    /**
     * @param tier the tier that matched, or null when nothing matched
     */
    void recordResolution(MatchTier tier);

    void recordCacheHit();

    void recordCacheMiss();

    void recordScore(int total, boolean qualified);

    void incrementUnmappedViolationType();

    void recordScoreSave(SaveOutcome outcome);
}

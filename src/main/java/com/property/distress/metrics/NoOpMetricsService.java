package com.property.distress.metrics;

import com.property.distress.core.model.MatchTier;
import com.property.distress.core.model.RecordType;
import com.property.distress.store.SaveOutcome;

import java.time.Duration;

/**
 * Metrics sink that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordIngestion(String source, long matched, long unmatched, long skipped, long failed,
                                Duration duration) {
    }

    @Override
    public void recordBatchCommit(RecordType type, int size) {
    }

    @Override
    public void recordResolution(MatchTier tier) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordScore(int total, boolean qualified) {
    }

    @Override
    public void incrementUnmappedViolationType() {
    }

    @Override
    public void recordScoreSave(SaveOutcome outcome) {
    }
}

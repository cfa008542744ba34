package com.property.distress.metrics;

import com.property.distress.core.model.MatchTier;
import com.property.distress.core.model.RecordType;
import com.property.distress.store.SaveOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code distress.ingest.rows}: Counter (tags: recordType, outcome)</li>
 *   <li>{@code distress.ingest.duration}: Timer (tag: recordType)</li>
 *   <li>{@code distress.ingest.batch.size}: DistributionSummary (tag: recordType)</li>
 *   <li>{@code distress.resolve.tier}: Counter (tag: tier, NONE for no match)</li>
 *   <li>{@code distress.cache.hit} / {@code distress.cache.miss}: Counter</li>
 *   <li>{@code distress.score.total}: DistributionSummary</li>
 *   <li>{@code distress.score.qualified}: Counter</li>
 *   <li>{@code distress.score.unmapped}: Counter</li>
 *   <li>{@code distress.score.saved}: Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final DistributionSummary scoreSummary;
    private final Counter qualifiedCounter;
    private final Counter unmappedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.scoreSummary = DistributionSummary.builder("distress.score.total")
                .description("Distribution of computed distress scores")
                .register(registry);
        this.qualifiedCounter = Counter.builder("distress.score.qualified")
                .description("Number of scores at or above the qualification threshold")
                .register(registry);
        this.unmappedCounter = Counter.builder("distress.score.unmapped")
                .description("Violations whose type matched no severity keyword")
                .register(registry);
        this.cacheHitCounter = Counter.builder("distress.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("distress.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordIngestion(String source, long matched, long unmatched, long skipped, long failed,
                                Duration duration) {
        rowCounter(source, "matched").increment(matched);
        rowCounter(source, "unmatched").increment(unmatched);
        rowCounter(source, "skipped").increment(skipped);
        rowCounter(source, "failed").increment(failed);
        timerCache.computeIfAbsent(source, k ->
                Timer.builder("distress.ingest.duration")
                        .description("Duration of ingestion runs")
                        .tag("recordType", source)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordBatchCommit(RecordType type, int size) {
        summaryCache.computeIfAbsent(type.name(), k ->
                DistributionSummary.builder("distress.ingest.batch.size")
                        .description("Signal records per committed batch")
                        .tag("recordType", type.name())
                        .register(registry))
                .record(size);
    }

    @Override
    public void recordResolution(MatchTier tier) {
        String tag = tier != null ? tier.name() : "NONE";
        counterCache.computeIfAbsent("resolve:" + tag, k ->
                Counter.builder("distress.resolve.tier")
                        .description("Resolution attempts by matching tier")
                        .tag("tier", tag)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordScore(int total, boolean qualified) {
        scoreSummary.record(total);
        if (qualified) {
            qualifiedCounter.increment();
        }
    }

    @Override
    public void incrementUnmappedViolationType() {
        unmappedCounter.increment();
    }

    @Override
    public void recordScoreSave(SaveOutcome outcome) {
        counterCache.computeIfAbsent("saved:" + outcome.name(), k ->
                Counter.builder("distress.score.saved")
                        .description("Score saves by outcome")
                        .tag("outcome", outcome.name())
                        .register(registry))
                .increment();
    }

    private Counter rowCounter(String source, String outcome) {
        return counterCache.computeIfAbsent("rows:" + source + ":" + outcome, k ->
                Counter.builder("distress.ingest.rows")
                        .description("Ingested rows by outcome")
                        .tag("recordType", source)
                        .tag("outcome", outcome)
                        .register(registry));
    }
}

package com.property.distress.scoring;

import com.property.distress.core.model.DistressScore;
import com.property.distress.core.model.LeadTier;
import com.property.distress.metrics.MetricsService;
import com.property.distress.store.DistressScoreRepository;
import com.property.distress.store.SaveOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persists scores as a compact history: at most one row per property per day, and no new
 * row when the score has not moved since the last one.
 */
public class ScoreStore {
    private static final Logger log = LoggerFactory.getLogger(ScoreStore.class);

    private final DistressScoreRepository repository;
    private final MetricsService metrics;
    private final Clock clock;

    public ScoreStore(DistressScoreRepository repository, MetricsService metrics, Clock clock) {
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Overwrites today's row when there is one. Otherwise inserts a new row, unless the latest
     * row already carries the same final score.
     */
    public SaveOutcome save(ScoreBreakdown breakdown) {
        LocalDate today = LocalDate.now(clock);
        Optional<DistressScore> todays = repository.findForDay(breakdown.propertyId(), today);

        if (todays.isEmpty()) {
            Optional<DistressScore> latest = repository.findLatest(breakdown.propertyId());
            if (latest.isPresent() && latest.get().finalScore() == breakdown.total()) {
                return record(breakdown, SaveOutcome.UNCHANGED);
            }
        }

        DistressScore score = new DistressScore(null, breakdown.propertyId(), Instant.now(clock),
                breakdown.total(), breakdown.tier(), breakdown.urgency(), breakdown.factors(),
                breakdown.qualified());
        repository.upsertForDay(score, today);
        return record(breakdown, todays.isPresent() ? SaveOutcome.UPDATED : SaveOutcome.INSERTED);
    }

    public List<DistressScore> findQualified(int minScore) {
        return repository.findLatestQualified(minScore);
    }

    public List<DistressScore> findByLeadTier(LeadTier tier) {
        return repository.findLatestByLeadTier(tier);
    }

    public Optional<DistressScore> findLatest(long propertyId) {
        return repository.findLatest(propertyId);
    }

    public Optional<DistressScore> findToday(long propertyId) {
        return repository.findForDay(propertyId, LocalDate.now(clock));
    }

    public List<DistressScore> findHistory(long propertyId) {
        return repository.findHistory(propertyId);
    }

    private SaveOutcome record(ScoreBreakdown breakdown, SaveOutcome outcome) {
        metrics.recordScoreSave(outcome);
        log.debug("score.saved propertyId={} total={} outcome={}", breakdown.propertyId(), breakdown.total(), outcome);
        return outcome;
    }
}

package com.property.distress.scoring;

import com.property.distress.logging.LogContext;
import com.property.distress.store.SaveOutcome;
import com.property.distress.store.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores every property that has at least one signal record.
 */
public class ScoringService {
    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    private final SignalRepository signals;
    private final ScoringEngine engine;
    private final ScoreStore store;

    public ScoringService(SignalRepository signals, ScoringEngine engine, ScoreStore store) {
        this.signals = signals;
        this.engine = engine;
        this.store = store;
    }

    /**
     * A property whose score cannot be computed is logged, counted and skipped. Persistence
     * failures are not caught.
     *
     * @param save whether to write each score through {@link ScoreStore}
     */
    public ScoringRunResult scoreAll(boolean save) {
        String runId = LogContext.generateRunId();
        try (LogContext ignored = LogContext.forScoring(runId)) {
            List<Long> propertyIds = signals.findPropertyIdsWithSignals();
            log.info("score.run_started properties={} save={}", propertyIds.size(), save);

            long scored = 0;
            long failed = 0;
            long qualified = 0;
            long sum = 0;
            Map<SaveOutcome, Long> outcomes = new EnumMap<>(SaveOutcome.class);

            for (Long propertyId : propertyIds) {
                ScoreBreakdown breakdown;
                try {
                    breakdown = engine.scoreProperty(propertyId);
                } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
                    failed++;
                    log.warn("score.failed propertyId={} error={}", propertyId, e.getMessage());
                    continue;
                }
                scored++;
                sum += breakdown.total();
                if (breakdown.qualified()) {
                    qualified++;
                }
                if (save) {
                    outcomes.merge(store.save(breakdown), 1L, Long::sum);
                }
            }

            ScoringRunResult result = new ScoringRunResult(scored, failed, qualified,
                    scored == 0 ? 0.0 : (double) sum / scored, outcomes);
            log.info("score.run_completed scored={} failed={} qualified={} average={} outcomes={}",
                    scored, failed, qualified, String.format("%.1f", result.averageScore()), outcomes);
            return result;
        }
    }
}

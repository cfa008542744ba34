package com.property.distress.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted scoring event. At most one exists per property per calendar day.
 */
public record DistressScore(
        Long id,
        long propertyId,
        Instant scoreDate,
        int finalScore,
        LeadTier leadTier,
        UrgencyLevel urgencyLevel,
        FactorScores factorScores,
        boolean qualified
) {
    public DistressScore {
        Objects.requireNonNull(scoreDate, "scoreDate is required");
        Objects.requireNonNull(leadTier, "leadTier is required");
        Objects.requireNonNull(urgencyLevel, "urgencyLevel is required");
        Objects.requireNonNull(factorScores, "factorScores is required");
        if (finalScore < 0 || finalScore > 100) {
            throw new IllegalArgumentException("finalScore must be between 0 and 100");
        }
    }

    public DistressScore withId(long newId) {
        return new DistressScore(newId, propertyId, scoreDate, finalScore, leadTier,
                urgencyLevel, factorScores, qualified);
    }
}

package com.property.distress.rest.dto;

import com.property.distress.core.model.DistressScore;
import com.property.distress.scoring.ScoreBreakdown;

import java.time.Instant;
import java.util.Map;

/**
 * A score as shown to lead consumers.
 *
 * @param scoreDate when the score was saved; null for a live computation
 */
public record ScoreResponse(
        long propertyId,
        int finalScore,
        String leadTier,
        String urgencyLevel,
        boolean qualified,
        Map<String, Integer> factors,
        Instant scoreDate
) {
    public static ScoreResponse from(DistressScore score) {
        return new ScoreResponse(score.propertyId(), score.finalScore(), score.leadTier().getLabel(),
                score.urgencyLevel().getLabel(), score.qualified(), score.factorScores().asMap(),
                score.scoreDate());
    }

    public static ScoreResponse from(ScoreBreakdown breakdown) {
        return new ScoreResponse(breakdown.propertyId(), breakdown.total(), breakdown.tier().getLabel(),
                breakdown.urgency().getLabel(), breakdown.qualified(), breakdown.factors().asMap(), null);
    }
}

package com.property.distress.scoring;

import com.property.distress.store.SaveOutcome;

import java.util.Map;

/**
 * Summary of a scoring run.
 *
 * @param scored       properties scored successfully
 * @param failed       properties whose score could not be computed
 * @param qualified    scored properties at or above the qualification threshold
 * @param averageScore mean total over scored properties, 0 when none
 * @param saveOutcomes how many saves ended in each outcome; empty when nothing was saved
 */
public record ScoringRunResult(
        long scored,
        long failed,
        long qualified,
        double averageScore,
        Map<SaveOutcome, Long> saveOutcomes
) {
    public ScoringRunResult {
        saveOutcomes = Map.copyOf(saveOutcomes);
    }
}

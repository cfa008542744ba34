package com.property.distress.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-shape breakdown of the six distress factors.
 */
public record FactorScores(
        int violationSeverity,
        int daysOpen,
        int violationPersistence,
        int absenteeOwnership,
        int priorViolations,
        int equity
) {
    public FactorScores {
        requireRange("violationSeverity", violationSeverity, 25);
        requireRange("daysOpen", daysOpen, 20);
        requireRange("violationPersistence", violationPersistence, 20);
        requireRange("absenteeOwnership", absenteeOwnership, 15);
        requireRange("priorViolations", priorViolations, 10);
        requireRange("equity", equity, 10);
    }

    public int total() {
        return violationSeverity + daysOpen + violationPersistence
                + absenteeOwnership + priorViolations + equity;
    }

    /**
     * Factor values keyed by their reporting names, in display order.
     */
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("violation_severity", violationSeverity);
        map.put("days_open", daysOpen);
        map.put("violation_persistence", violationPersistence);
        map.put("absentee_ownership", absenteeOwnership);
        map.put("prior_violations", priorViolations);
        map.put("equity_vs_repair", equity);
        return map;
    }

    private static void requireRange(String name, int value, int cap) {
        if (value < 0 || value > cap) {
            throw new IllegalArgumentException(name + " must be between 0 and " + cap + ", was " + value);
        }
    }
}

package com.property.distress.scoring;

import com.property.distress.core.model.FactorScores;
import com.property.distress.core.model.LeadTier;
import com.property.distress.core.model.UrgencyLevel;

import java.util.Objects;

/**
 * A computed, not yet persisted, distress score.
 */
public record ScoreBreakdown(
        long propertyId,
        FactorScores factors,
        int total,
        boolean qualified,
        LeadTier tier,
        UrgencyLevel urgency
) {
    public ScoreBreakdown {
        Objects.requireNonNull(factors, "factors are required");
        Objects.requireNonNull(tier, "tier is required");
        Objects.requireNonNull(urgency, "urgency is required");
        if (total != factors.total()) {
            throw new IllegalArgumentException("total " + total + " does not equal the factor sum " + factors.total());
        }
    }

    public int severity() {
        return factors.violationSeverity();
    }

    public int daysOpen() {
        return factors.daysOpen();
    }

    public int persistence() {
        return factors.violationPersistence();
    }

    public int absentee() {
        return factors.absenteeOwnership();
    }

    public int priorViolations() {
        return factors.priorViolations();
    }

    public int equity() {
        return factors.equity();
    }
}

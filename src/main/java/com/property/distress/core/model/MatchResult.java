package com.property.distress.core.model;

import java.util.Objects;

/**
 * Outcome of resolving a record to a property. Transient, never persisted.
 *
 * @param property   the matched property
 * @param confidence similarity on a 0-100 scale; exact tiers always report 100
 * @param tier       the resolver tier that produced the match
 */
public record MatchResult(
        Property property,
        double confidence,
        MatchTier tier
) {
    public static final double EXACT_CONFIDENCE = 100.0;

    public MatchResult {
        Objects.requireNonNull(property, "property is required");
        Objects.requireNonNull(tier, "tier is required");
        if (confidence < 0.0 || confidence > 100.0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 100");
        }
    }

    public static MatchResult exact(Property property, MatchTier tier) {
        return new MatchResult(property, EXACT_CONFIDENCE, tier);
    }

    public long propertyId() {
        return property.getId();
    }
}

package com.property.distress.core.model;

/**
 * Resolver tiers, in the order they are attempted.
 */
public enum MatchTier {
    PARCEL_ID(true),
    EXACT_ADDRESS(true),
    FUZZY_ADDRESS(false),
    EXACT_OWNER(true),
    PARTIAL_OWNER(false),
    FALLBACK_OWNER(false);

    private final boolean exact;

    MatchTier(boolean exact) {
        this.exact = exact;
    }

    public boolean isExact() {
        return exact;
    }
}

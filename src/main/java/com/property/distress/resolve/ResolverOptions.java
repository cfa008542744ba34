package com.property.distress.resolve;

/**
 * Candidate windows and acceptance thresholds for the fuzzy resolver tiers.
 * Thresholds are on the 0-100 similarity scale.
 */
public class ResolverOptions {

    private static final int DEFAULT_FUZZY_ADDRESS_WINDOW = 1_000;
    private static final double DEFAULT_FUZZY_ADDRESS_THRESHOLD = 85.0;
    private static final int DEFAULT_PARTIAL_OWNER_LIMIT = 50;
    private static final int DEFAULT_FALLBACK_OWNER_WINDOW = 100;
    private static final double DEFAULT_OWNER_THRESHOLD = 75.0;

    private final int fuzzyAddressWindow;
    private final double fuzzyAddressThreshold;
    private final int partialOwnerLimit;
    private final int fallbackOwnerWindow;
    private final double ownerThreshold;

    private ResolverOptions(Builder builder) {
        this.fuzzyAddressWindow = builder.fuzzyAddressWindow;
        this.fuzzyAddressThreshold = builder.fuzzyAddressThreshold;
        this.partialOwnerLimit = builder.partialOwnerLimit;
        this.fallbackOwnerWindow = builder.fallbackOwnerWindow;
        this.ownerThreshold = builder.ownerThreshold;
    }

    /**
     * Number of properties, lowest id first, scanned by the fuzzy address tier.
     */
    public int getFuzzyAddressWindow() {
        return fuzzyAddressWindow;
    }

    public double getFuzzyAddressThreshold() {
        return fuzzyAddressThreshold;
    }

    public int getPartialOwnerLimit() {
        return partialOwnerLimit;
    }

    public int getFallbackOwnerWindow() {
        return fallbackOwnerWindow;
    }

    /**
     * Acceptance threshold shared by the partial and fallback owner tiers.
     */
    public double getOwnerThreshold() {
        return ownerThreshold;
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int fuzzyAddressWindow = DEFAULT_FUZZY_ADDRESS_WINDOW;
        private double fuzzyAddressThreshold = DEFAULT_FUZZY_ADDRESS_THRESHOLD;
        private int partialOwnerLimit = DEFAULT_PARTIAL_OWNER_LIMIT;
        private int fallbackOwnerWindow = DEFAULT_FALLBACK_OWNER_WINDOW;
        private double ownerThreshold = DEFAULT_OWNER_THRESHOLD;

        public Builder fuzzyAddressWindow(int fuzzyAddressWindow) {
            this.fuzzyAddressWindow = fuzzyAddressWindow;
            return this;
        }

        public Builder fuzzyAddressThreshold(double fuzzyAddressThreshold) {
            this.fuzzyAddressThreshold = fuzzyAddressThreshold;
            return this;
        }

        public Builder partialOwnerLimit(int partialOwnerLimit) {
            this.partialOwnerLimit = partialOwnerLimit;
            return this;
        }

        public Builder fallbackOwnerWindow(int fallbackOwnerWindow) {
            this.fallbackOwnerWindow = fallbackOwnerWindow;
            return this;
        }

        public Builder ownerThreshold(double ownerThreshold) {
            this.ownerThreshold = ownerThreshold;
            return this;
        }

        public ResolverOptions build() {
            if (fuzzyAddressWindow < 0 || partialOwnerLimit < 0 || fallbackOwnerWindow < 0) {
                throw new IllegalArgumentException("Candidate windows must be >= 0");
            }
            if (fuzzyAddressThreshold < 0 || fuzzyAddressThreshold > 100
                    || ownerThreshold < 0 || ownerThreshold > 100) {
                throw new IllegalArgumentException("Thresholds must be between 0 and 100");
            }
            return new ResolverOptions(this);
        }
    }
}

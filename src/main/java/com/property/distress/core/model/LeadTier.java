package com.property.distress.core.model;

/**
 * Human-facing lead bucket derived from the distress score.
 */
public enum LeadTier {
    ULTRA_PLATINUM("Ultra Platinum"),
    PLATINUM("Platinum"),
    GOLD("Gold"),
    SILVER("Silver"),
    BRONZE("Bronze");

    private final String label;

    LeadTier(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Accepts the enum name or the display label ("Ultra Platinum", "ultra-platinum").
     *
     * @throws IllegalArgumentException for unknown tiers
     */
    public static LeadTier fromLabel(String value) {
        if (value != null) {
            String compact = value.trim().replace('-', ' ').replace('_', ' ');
            for (LeadTier tier : values()) {
                if (tier.label.equalsIgnoreCase(compact)) {
                    return tier;
                }
            }
        }
        throw new IllegalArgumentException("Unknown lead tier: " + value);
    }
}

package com.property.distress.core.model;

/**
 * How soon a lead should be worked. Breakpoints are independent of {@link LeadTier}.
 */
public enum UrgencyLevel {
    IMMEDIATE("Immediate"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    UrgencyLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

package com.property.distress.core.model;

/**
 * Where an owner's mailing address sits relative to the property it owns.
 */
public enum AbsenteeStatus {
    IN_COUNTY("In-County"),
    OUT_OF_COUNTY("Out-of-County"),
    OUT_OF_STATE("Out-of-State");

    private final String label;

    AbsenteeStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses either the enum name or its label. Returns null for blank or unknown input.
     */
    public static AbsenteeStatus fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (AbsenteeStatus status : values()) {
            if (status.label.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed)) {
                return status;
            }
        }
        return null;
    }
}

package com.property.distress.core.model;

/**
 * A law-enforcement incident reported at the property address.
 */
public record IncidentDetails(
        String incidentType,
        String disposition
) implements SignalDetails {
}

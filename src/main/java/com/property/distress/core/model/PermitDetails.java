package com.property.distress.core.model;

import java.time.LocalDate;

/**
 * A building permit.
 */
public record PermitDetails(
        String permitType,
        String status,
        LocalDate issueDate,
        LocalDate expirationDate,
        String description
) implements SignalDetails {
}

package com.property.distress.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A code-enforcement violation.
 *
 * @param violationType free-text violation category, classified by keyword at scoring time
 * @param status        current case status (e.g. "Hearing Scheduled")
 * @param openedDate    date the case was opened, may be null
 * @param closedDate    date the case was closed, null while open
 * @param lien          whether the violation has been converted into a lien
 * @param fineAmount    accrued fine, may be null
 */
public record ViolationDetails(
        String violationType,
        String status,
        LocalDate openedDate,
        LocalDate closedDate,
        boolean lien,
        BigDecimal fineAmount
) implements SignalDetails {

    public boolean isOpen() {
        return closedDate == null;
    }
}

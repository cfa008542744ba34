package com.property.distress.core.model;

import java.math.BigDecimal;

/**
 * An unpaid property-tax account for a single tax year.
 */
public record TaxDelinquencyDetails(
        int taxYear,
        BigDecimal amountDue,
        Integer yearsDelinquent,
        String accountStatus,
        String certificateStatus,
        String deedStatus
) implements SignalDetails {
}

package com.property.distress.core.model;

import java.math.BigDecimal;

/**
 * A recorded deed transfer.
 */
public record DeedDetails(
        String deedType,
        String grantor,
        String grantee,
        BigDecimal salePrice
) implements SignalDetails {
}

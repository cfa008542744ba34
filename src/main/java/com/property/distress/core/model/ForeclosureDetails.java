package com.property.distress.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A foreclosure case, usually with a scheduled auction.
 */
public record ForeclosureDetails(
        String plaintiff,
        String defendant,
        BigDecimal judgmentAmount,
        LocalDate auctionDate
) implements SignalDetails {
}

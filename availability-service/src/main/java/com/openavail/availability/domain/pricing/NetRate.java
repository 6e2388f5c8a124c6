package com.openavail.availability.domain.pricing;

import java.math.BigDecimal;

/**
 * Supplier cost of one destination and the margin to apply on top of it.
 */
public record NetRate(
        String supplierHotelCode,
        BigDecimal netAmount,
        String netCurrency,
        BigDecimal markupPercentage,
        BigDecimal exchangeRate
) {
}

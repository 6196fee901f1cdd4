package com.vybescope.domain;

import java.math.BigDecimal;

/**
 * Token metadata and market figures for dashboard display. Not used by alert logic.
 */
public record TokenStats(
        String mintAddress,
        String symbol,
        String name,
        BigDecimal price,
        BigDecimal price1d,
        BigDecimal price7d,
        BigDecimal marketCap,
        BigDecimal currentSupply,
        BigDecimal usdValueVolume24h,
        boolean verified,
        String logoUrl
) {
}

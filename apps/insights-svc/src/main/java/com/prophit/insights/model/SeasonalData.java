package com.prophit.insights.model;

import java.math.BigDecimal;

/**
 * Average monthly outflow per meteorological season (winter = Dec, Jan, Feb).
 */
public record SeasonalData(BigDecimal winter, BigDecimal spring, BigDecimal summer, BigDecimal autumn) {

    public static SeasonalData empty() {
        BigDecimal zero = BigDecimal.ZERO.setScale(2);
        return new SeasonalData(zero, zero, zero, zero);
    }
}

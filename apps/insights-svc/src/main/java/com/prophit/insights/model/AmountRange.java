package com.prophit.insights.model;

import java.math.BigDecimal;

public record AmountRange(BigDecimal min, BigDecimal max) {

    public AmountRange {
        if (min == null || max == null) {
            throw new InvalidConfigurationException("range bounds must be provided");
        }
        if (min.signum() < 0) {
            throw new InvalidConfigurationException("range minimum must not be negative: " + min);
        }
        if (min.compareTo(max) > 0) {
            throw new InvalidConfigurationException("range minimum " + min + " exceeds maximum " + max);
        }
    }

    public static AmountRange of(long min, long max) {
        return new AmountRange(BigDecimal.valueOf(min), BigDecimal.valueOf(max));
    }
}

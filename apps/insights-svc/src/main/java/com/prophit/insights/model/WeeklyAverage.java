package com.prophit.insights.model;

import java.math.BigDecimal;

/**
 * Outflow total for one trailing week; week 0 ends on the as-of date.
 */
public record WeeklyAverage(int week, BigDecimal amount) {
}

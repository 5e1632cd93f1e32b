package com.prophit.insights.analytics;

import com.prophit.insights.model.SpendingTrend;
import java.math.BigDecimal;

public record TrendProjection(
        SpendingTrend spendingTrend,
        BigDecimal projectedMonthlySpend,
        BigDecimal runwayMonths,
        int savingsRate,
        BigDecimal monthlyIncome,
        BigDecimal savings
) {
}

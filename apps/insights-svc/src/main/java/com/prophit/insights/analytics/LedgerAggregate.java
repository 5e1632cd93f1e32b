package com.prophit.insights.analytics;

import com.prophit.insights.model.MonthlySnapshot;
import com.prophit.insights.model.SeasonalData;
import com.prophit.insights.model.WeeklyAverage;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Raw figures produced by {@link AggregationEngine}; input to the trend calculator.
 * {@code monthRange} is the fractional month span used as the divisor for monthly averages.
 */
public record LedgerAggregate(
        BigDecimal totalSpent,
        BigDecimal totalIncome,
        long dayRange,
        BigDecimal monthRange,
        BigDecimal avgDaily,
        BigDecimal avgMonthly,
        Map<String, BigDecimal> categoryTotals,
        List<String> topCategories,
        List<MonthlySnapshot> monthlySnapshots,
        List<WeeklyAverage> weeklyAverages,
        SeasonalData seasonalData
) {
}

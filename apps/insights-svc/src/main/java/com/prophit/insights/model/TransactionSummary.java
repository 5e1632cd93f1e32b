package com.prophit.insights.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything derived from one ledger at one as-of instant. Never edited, only recomputed.
 */
public record TransactionSummary(
        BigDecimal totalSpent,
        BigDecimal totalIncome,
        BigDecimal avgDaily,
        BigDecimal avgMonthly,
        Map<String, BigDecimal> categoryTotals,
        List<String> topCategories,
        List<MonthlySnapshot> monthlySnapshots,
        List<WeeklyAverage> weeklyAverages,
        SeasonalData seasonalData,
        SpendingTrend spendingTrend,
        int savingsRate,
        BigDecimal projectedMonthlySpend,
        BigDecimal runwayMonths,
        BigDecimal monthlyIncome,
        BigDecimal savings,
        BigDecimal dataRangeMonths
) {
    public TransactionSummary {
        categoryTotals = Collections.unmodifiableMap(new LinkedHashMap<>(categoryTotals));
        topCategories = List.copyOf(topCategories);
        monthlySnapshots = List.copyOf(monthlySnapshots);
        weeklyAverages = List.copyOf(weeklyAverages);
    }
}

package com.prophit.insights.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@JsonPropertyOrder({
        "totalSpent", "totalIncome", "avgDaily", "avgMonthly", "topCategories", "categoryTotals",
        "monthlyIncome", "savings", "monthlySnapshots", "weeklyAverages", "seasonalData",
        "spendingTrend", "savingsRate", "projectedMonthlySpend", "runwayMonths", "dataRangeMonths"
})
public record TransactionSummaryDto(
        BigDecimal totalSpent,
        BigDecimal totalIncome,
        BigDecimal avgDaily,
        BigDecimal avgMonthly,
        List<String> topCategories,
        Map<String, BigDecimal> categoryTotals,
        BigDecimal monthlyIncome,
        BigDecimal savings,
        List<MonthlySnapshot> monthlySnapshots,
        List<WeeklyAverage> weeklyAverages,
        SeasonalData seasonalData,
        String spendingTrend,
        int savingsRate,
        BigDecimal projectedMonthlySpend,
        BigDecimal runwayMonths,
        BigDecimal dataRangeMonths
) {
    @JsonPropertyOrder({"month", "totalSpent", "totalIncome", "netSavings", "topCategory"})
    public record MonthlySnapshot(String month, BigDecimal totalSpent, BigDecimal totalIncome, BigDecimal netSavings, String topCategory) {
    }

    @JsonPropertyOrder({"week", "amount"})
    public record WeeklyAverage(int week, BigDecimal amount) {
    }

    @JsonPropertyOrder({"winter", "spring", "summer", "autumn"})
    public record SeasonalData(BigDecimal winter, BigDecimal spring, BigDecimal summer, BigDecimal autumn) {
    }
}

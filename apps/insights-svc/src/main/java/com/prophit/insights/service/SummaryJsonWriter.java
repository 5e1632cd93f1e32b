package com.prophit.insights.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prophit.insights.dto.TransactionSummaryDto;
import com.prophit.insights.model.TransactionSummary;
import org.springframework.stereotype.Component;

/**
 * Flattens a summary into the stable-keyed shape handed to display and storage collaborators.
 */
@Component
public class SummaryJsonWriter {

    private final ObjectMapper objectMapper;

    public SummaryJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(TransactionSummary summary) {
        try {
            return objectMapper.writeValueAsString(toDto(summary));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize transaction summary", ex);
        }
    }

    public TransactionSummaryDto toDto(TransactionSummary summary) {
        return new TransactionSummaryDto(
                summary.totalSpent(),
                summary.totalIncome(),
                summary.avgDaily(),
                summary.avgMonthly(),
                summary.topCategories(),
                summary.categoryTotals(),
                summary.monthlyIncome(),
                summary.savings(),
                summary.monthlySnapshots().stream()
                        .map(snapshot -> new TransactionSummaryDto.MonthlySnapshot(
                                snapshot.month().toString(),
                                snapshot.totalSpent(),
                                snapshot.totalIncome(),
                                snapshot.netSavings(),
                                snapshot.topCategory()
                        ))
                        .toList(),
                summary.weeklyAverages().stream()
                        .map(week -> new TransactionSummaryDto.WeeklyAverage(week.week(), week.amount()))
                        .toList(),
                new TransactionSummaryDto.SeasonalData(
                        summary.seasonalData().winter(),
                        summary.seasonalData().spring(),
                        summary.seasonalData().summer(),
                        summary.seasonalData().autumn()
                ),
                summary.spendingTrend().label(),
                summary.savingsRate(),
                summary.projectedMonthlySpend(),
                summary.runwayMonths(),
                summary.dataRangeMonths()
        );
    }
}

package com.prophit.insights.analytics;

import com.prophit.insights.model.Transaction;
import com.prophit.insights.model.TransactionSummary;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Single summary path for every ledger, synthetic or user-supplied.
 */
@Service
public class SummaryAssembler {

    private final AggregationEngine aggregationEngine;
    private final TrendProjectionCalculator trendProjectionCalculator;

    public SummaryAssembler(AggregationEngine aggregationEngine, TrendProjectionCalculator trendProjectionCalculator) {
        this.aggregationEngine = aggregationEngine;
        this.trendProjectionCalculator = trendProjectionCalculator;
    }

    /**
     * {@code weeks} is the number of trailing weekly windows; callers pass the configured live or
     * synthetic count.
     */
    public TransactionSummary summarize(List<Transaction> transactions, Instant asOf, int weeks) {
        LedgerAggregate aggregate = aggregationEngine.aggregate(transactions, asOf, weeks);
        TrendProjection projection = trendProjectionCalculator.calculate(aggregate);
        return new TransactionSummary(
                aggregate.totalSpent(),
                aggregate.totalIncome(),
                aggregate.avgDaily(),
                aggregate.avgMonthly(),
                aggregate.categoryTotals(),
                aggregate.topCategories(),
                aggregate.monthlySnapshots(),
                aggregate.weeklyAverages(),
                aggregate.seasonalData(),
                projection.spendingTrend(),
                projection.savingsRate(),
                projection.projectedMonthlySpend(),
                projection.runwayMonths(),
                projection.monthlyIncome(),
                projection.savings(),
                aggregate.monthRange().setScale(1, RoundingMode.HALF_UP)
        );
    }
}

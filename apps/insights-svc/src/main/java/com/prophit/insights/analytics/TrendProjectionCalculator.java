package com.prophit.insights.analytics;

import com.prophit.insights.model.MonthlySnapshot;
import com.prophit.insights.model.SpendingTrend;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns monthly snapshots into a trend label, a burn-rate projection and a runway estimate.
 * Every division is guarded; degenerate input yields zero rather than an exception.
 */
@Component
public class TrendProjectionCalculator {

    static final BigDecimal INCREASE_THRESHOLD = new BigDecimal("1.08");
    static final BigDecimal DECREASE_THRESHOLD = new BigDecimal("0.92");
    private static final List<BigDecimal> PROJECTION_WEIGHTS = List.of(
            new BigDecimal("0.5"),
            new BigDecimal("0.3"),
            new BigDecimal("0.2")
    );
    private static final int TREND_WINDOW = 3;
    private static final int AVERAGE_SCALE = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public TrendProjection calculate(LedgerAggregate aggregate) {
        BigDecimal projected = projectMonthlySpend(aggregate.monthlySnapshots(), aggregate.avgMonthly());
        BigDecimal savings = savingsBalance(aggregate.totalIncome(), aggregate.totalSpent());
        BigDecimal monthlyIncome = aggregate.totalIncome()
                .divide(aggregate.monthRange(), 2, RoundingMode.HALF_UP);
        return new TrendProjection(
                classifyTrend(aggregate.monthlySnapshots()),
                projected,
                runwayMonths(savings, projected),
                savingsRate(aggregate.totalIncome(), aggregate.totalSpent()),
                monthlyIncome,
                savings
        );
    }

    /**
     * Compares the last three months against the three before them. With no earlier months the
     * recent average is compared against itself, which always reads as stable.
     */
    public SpendingTrend classifyTrend(List<MonthlySnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return SpendingTrend.STABLE;
        }
        int size = snapshots.size();
        List<MonthlySnapshot> recent = snapshots.subList(Math.max(0, size - TREND_WINDOW), size);
        List<MonthlySnapshot> older = snapshots.subList(Math.max(0, size - 2 * TREND_WINDOW), Math.max(0, size - TREND_WINDOW));
        BigDecimal recentAvg = meanSpent(recent);
        BigDecimal olderAvg = older.isEmpty() ? recentAvg : meanSpent(older);

        if (recentAvg.compareTo(olderAvg.multiply(INCREASE_THRESHOLD)) > 0) {
            return SpendingTrend.INCREASING;
        }
        if (recentAvg.compareTo(olderAvg.multiply(DECREASE_THRESHOLD)) < 0) {
            return SpendingTrend.DECREASING;
        }
        return SpendingTrend.STABLE;
    }

    /**
     * Weighted blend of the three most recent months (0.5 / 0.3 / 0.2, newest first), or the
     * average month when fewer than three months are known.
     */
    public BigDecimal projectMonthlySpend(List<MonthlySnapshot> snapshots, BigDecimal avgMonthly) {
        if (snapshots == null || snapshots.size() < TREND_WINDOW) {
            return avgMonthly == null ? BigDecimal.ZERO.setScale(2) : avgMonthly.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal projected = BigDecimal.ZERO;
        for (int i = 0; i < PROJECTION_WEIGHTS.size(); i++) {
            MonthlySnapshot snapshot = snapshots.get(snapshots.size() - 1 - i);
            projected = projected.add(snapshot.totalSpent().multiply(PROJECTION_WEIGHTS.get(i)));
        }
        return projected.setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal runwayMonths(BigDecimal savings, BigDecimal projectedMonthlySpend) {
        if (savings == null || projectedMonthlySpend == null
                || savings.signum() <= 0 || projectedMonthlySpend.signum() <= 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        return savings.divide(projectedMonthlySpend, 1, RoundingMode.HALF_UP);
    }

    public int savingsRate(BigDecimal totalIncome, BigDecimal totalSpent) {
        if (totalIncome == null || totalIncome.signum() <= 0) {
            return 0;
        }
        BigDecimal spent = totalSpent == null ? BigDecimal.ZERO : totalSpent;
        int rate = totalIncome.subtract(spent)
                .multiply(HUNDRED)
                .divide(totalIncome, 0, RoundingMode.HALF_UP)
                .intValue();
        return Math.max(0, Math.min(100, rate));
    }

    /**
     * Savings observed over the ledger: net income, floored at zero.
     */
    public BigDecimal savingsBalance(BigDecimal totalIncome, BigDecimal totalSpent) {
        return totalIncome.subtract(totalSpent).max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal meanSpent(List<MonthlySnapshot> snapshots) {
        BigDecimal sum = snapshots.stream()
                .map(MonthlySnapshot::totalSpent)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(snapshots.size()), AVERAGE_SCALE, RoundingMode.HALF_UP);
    }
}

package com.prophit.insights.analytics;

import com.prophit.insights.config.InsightsProperties;
import com.prophit.insights.model.MonthlySnapshot;
import com.prophit.insights.model.SeasonalData;
import com.prophit.insights.model.Transaction;
import com.prophit.insights.model.WeeklyAverage;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class AggregationEngine {

    static final int TOP_CATEGORY_LIMIT = 5;
    private static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);
    private static final int RANGE_SCALE = 6;

    private static final Set<Month> WINTER = Set.of(Month.DECEMBER, Month.JANUARY, Month.FEBRUARY);
    private static final Set<Month> SPRING = Set.of(Month.MARCH, Month.APRIL, Month.MAY);
    private static final Set<Month> SUMMER = Set.of(Month.JUNE, Month.JULY, Month.AUGUST);
    private static final Set<Month> AUTUMN = Set.of(Month.SEPTEMBER, Month.OCTOBER, Month.NOVEMBER);

    private final ZoneId zone;
    private final String fallbackCategory;

    @Autowired
    public AggregationEngine(InsightsProperties properties) {
        this(properties.anchor().zoneId(), properties.summary().fallbackCategory());
    }

    public AggregationEngine(ZoneId zone, String fallbackCategory) {
        this.zone = zone;
        this.fallbackCategory = fallbackCategory;
    }

    public LedgerAggregate aggregate(List<Transaction> transactions, Instant asOf, int weeks) {
        List<Transaction> ledger = transactions == null ? List.of() : transactions;
        BigDecimal totalSpent = ledger.stream()
                .filter(Transaction::isOutflow)
                .map(tx -> tx.amount().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalIncome = ledger.stream()
                .filter(Transaction::isInflow)
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        long dayRange = dayRange(ledger);
        BigDecimal monthRange = BigDecimal.valueOf(dayRange)
                .divide(DAYS_PER_MONTH, RANGE_SCALE, RoundingMode.HALF_UP)
                .max(BigDecimal.ONE);
        BigDecimal avgDaily = totalSpent.divide(BigDecimal.valueOf(dayRange), 2, RoundingMode.HALF_UP);
        BigDecimal avgMonthly = totalSpent.divide(monthRange, 2, RoundingMode.HALF_UP);

        Map<String, BigDecimal> categoryTotals = categoryTotals(ledger);
        return new LedgerAggregate(
                money(totalSpent),
                money(totalIncome),
                dayRange,
                monthRange,
                avgDaily,
                avgMonthly,
                categoryTotals,
                topCategories(categoryTotals, TOP_CATEGORY_LIMIT),
                monthlySnapshots(ledger),
                weeklyTotals(ledger, asOf, weeks),
                seasonalData(ledger)
        );
    }

    /**
     * Day span between the earliest and latest transaction, never less than one.
     */
    static long dayRange(List<Transaction> transactions) {
        if (transactions.isEmpty()) {
            return 1;
        }
        LocalDate min = transactions.stream().map(Transaction::date).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate max = transactions.stream().map(Transaction::date).max(Comparator.naturalOrder()).orElseThrow();
        return Math.max(1, ChronoUnit.DAYS.between(min, max));
    }

    /**
     * Outflow totals per category label, keyed in order of first appearance.
     */
    static Map<String, BigDecimal> categoryTotals(List<Transaction> transactions) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (tx.isOutflow()) {
                totals.merge(tx.category(), tx.amount().abs(), BigDecimal::add);
            }
        }
        totals.replaceAll((category, amount) -> money(amount));
        return totals;
    }

    // Stream sort is stable, so equal totals keep first-appearance order.
    static List<String> topCategories(Map<String, BigDecimal> categoryTotals, int limit) {
        return categoryTotals.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    private List<MonthlySnapshot> monthlySnapshots(List<Transaction> transactions) {
        Map<YearMonth, List<Transaction>> byMonth = new TreeMap<>();
        for (Transaction tx : transactions) {
            byMonth.computeIfAbsent(tx.month(), key -> new ArrayList<>()).add(tx);
        }
        List<MonthlySnapshot> snapshots = new ArrayList<>(byMonth.size());
        for (Map.Entry<YearMonth, List<Transaction>> entry : byMonth.entrySet()) {
            List<Transaction> monthTransactions = entry.getValue();
            BigDecimal spent = BigDecimal.ZERO;
            BigDecimal income = BigDecimal.ZERO;
            for (Transaction tx : monthTransactions) {
                if (tx.isOutflow()) {
                    spent = spent.add(tx.amount().abs());
                } else if (tx.isInflow()) {
                    income = income.add(tx.amount());
                }
            }
            spent = money(spent);
            income = money(income);
            String topCategory = topCategories(categoryTotals(monthTransactions), 1).stream()
                    .findFirst()
                    .orElse(fallbackCategory);
            snapshots.add(new MonthlySnapshot(entry.getKey(), spent, income, income.subtract(spent), topCategory));
        }
        return snapshots;
    }

    /**
     * Week {@code n} covers the seven calendar days ending {@code 7n} days before the as-of date.
     */
    private List<WeeklyAverage> weeklyTotals(List<Transaction> transactions, Instant asOf, int weeks) {
        if (weeks <= 0) {
            return List.of();
        }
        if (asOf == null) {
            throw new IllegalArgumentException("asOf must be provided for weekly totals");
        }
        LocalDate anchor = asOf.atZone(zone).toLocalDate();
        List<WeeklyAverage> result = new ArrayList<>(weeks);
        for (int week = 0; week < weeks; week++) {
            LocalDate weekEnd = anchor.minusDays(7L * week);
            LocalDate weekStart = weekEnd.minusDays(6);
            BigDecimal total = transactions.stream()
                    .filter(Transaction::isOutflow)
                    .filter(tx -> !tx.date().isBefore(weekStart) && !tx.date().isAfter(weekEnd))
                    .map(tx -> tx.amount().abs())
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            result.add(new WeeklyAverage(week, money(total)));
        }
        return result;
    }

    private SeasonalData seasonalData(List<Transaction> transactions) {
        if (transactions.isEmpty()) {
            return SeasonalData.empty();
        }
        return new SeasonalData(
                seasonAverage(transactions, WINTER),
                seasonAverage(transactions, SPRING),
                seasonAverage(transactions, SUMMER),
                seasonAverage(transactions, AUTUMN)
        );
    }

    // Divides by the distinct calendar months of the season present in the ledger.
    private static BigDecimal seasonAverage(List<Transaction> transactions, Set<Month> season) {
        List<Transaction> inSeason = transactions.stream()
                .filter(tx -> season.contains(tx.date().getMonth()))
                .toList();
        long months = inSeason.stream().map(Transaction::month).distinct().count();
        if (months == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal total = inSeason.stream()
                .filter(Transaction::isOutflow)
                .map(tx -> tx.amount().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(months), 2, RoundingMode.HALF_UP);
    }

    static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}

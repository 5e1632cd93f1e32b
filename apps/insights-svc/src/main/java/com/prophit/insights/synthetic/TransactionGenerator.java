package com.prophit.insights.synthetic;

import com.prophit.insights.config.InsightsProperties;
import com.prophit.insights.model.Category;
import com.prophit.insights.model.InvalidConfigurationException;
import com.prophit.insights.model.PersonaProfile;
import com.prophit.insights.model.Transaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleBiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fabricates a persona's ledger: fixed monthly items (income, rent, utilities, subscriptions,
 * transfers) plus per-day discretionary spend shaped by style, season, weekday and trend.
 */
@Component
public class TransactionGenerator {

    private static final Logger log = LoggerFactory.getLogger(TransactionGenerator.class);

    private static final BigDecimal RENT_STEP = BigDecimal.valueOf(50);
    private static final int LAST_RANDOM_DAY = 28;

    private static final List<DailyRule> DAILY_RULES = List.of(
            new DailyRule(Category.COFFEE, 3, 6.5, (profile, date) -> profile.spendingStyle().coffeeChance()),
            new DailyRule(Category.GROCERIES, 25, 100, (profile, date) -> 0.35),
            new DailyRule(Category.DINING, 14, 54, (profile, date) ->
                    profile.spendingStyle().diningChance() * TemporalMultipliers.weekdayMultiplier(date)),
            new DailyRule(Category.TRANSPORT, 4, 26, (profile, date) -> 0.40),
            new DailyRule(Category.SHOPPING, 20, 140, (profile, date) ->
                    (profile.focusesOn(Category.SHOPPING) ? 0.18 : 0.08) * TemporalMultipliers.weekdayMultiplier(date)),
            new DailyRule(Category.ENTERTAINMENT, 12, 67, (profile, date) ->
                    (profile.focusesOn(Category.ENTERTAINMENT) ? 0.15 : 0.06) * TemporalMultipliers.weekdayMultiplier(date)),
            new DailyRule(Category.HEALTHCARE, 15, 95, (profile, date) -> 0.03),
            new DailyRule(Category.EDUCATION, 10, 50, (profile, date) -> 0.02)
    );

    private final ZoneId zone;

    @Autowired
    public TransactionGenerator(InsightsProperties properties) {
        this(properties.anchor().zoneId());
    }

    public TransactionGenerator(ZoneId zone) {
        this.zone = zone;
    }

    public GenerationResult generate(Persona persona, GenerationWindow window, Instant asOf, RandomSource random) {
        if (persona == null || window == null || asOf == null || random == null) {
            throw new InvalidConfigurationException("persona, window, asOf and random source must be provided");
        }
        PersonaProfile profile = persona.profile();
        int oldestOffset = window.lengthMonths() - 1;
        if (profile.trendDirection().multiplier(oldestOffset) <= 0) {
            throw new InvalidConfigurationException("window of " + window.lengthMonths()
                    + " months drives the " + profile.trendDirection() + " trend multiplier to zero");
        }

        List<Transaction> transactions = new ArrayList<>();
        Map<YearMonth, GenerationResult.MonthlyTotals> totals = new LinkedHashMap<>();
        List<YearMonth> months = window.months(YearMonth.from(asOf.atZone(zone)));
        for (int monthOffset = 0; monthOffset < months.size(); monthOffset++) {
            YearMonth month = months.get(monthOffset);
            MonthLedger ledger = new MonthLedger(month, transactions);
            addFixedItems(persona, ledger, random);
            addDailySpend(profile, ledger, profile.trendDirection().multiplier(monthOffset), random);
            addTransfers(ledger, random);
            totals.put(month, ledger.totals);
        }

        transactions.sort(Comparator.comparing(Transaction::date).reversed());
        log.debug("Generated {} transactions over {} months (style={}, trend={})",
                transactions.size(), months.size(), profile.spendingStyle(), profile.trendDirection());
        return new GenerationResult(persona, Collections.unmodifiableList(transactions), Collections.unmodifiableMap(totals));
    }

    private void addFixedItems(Persona persona, MonthLedger ledger, RandomSource random) {
        double income = persona.monthlyIncome().doubleValue();
        ledger.income(1, MerchantCatalog.pick(Category.INCOME, random), money(income * random.uniform(0.95, 1.05)));

        BigDecimal rent = BigDecimal.valueOf(income * random.uniform(0.28, 0.40))
                .divide(RENT_STEP, 0, RoundingMode.HALF_UP)
                .multiply(RENT_STEP)
                .setScale(2, RoundingMode.HALF_UP);
        ledger.expense(1, MerchantCatalog.pick(Category.RENT, random), rent, Category.RENT);

        int utilityDay = 6 + random.nextInt(5);
        ledger.expense(utilityDay, MerchantCatalog.pick(Category.UTILITIES, random),
                money(random.uniform(60, 140)), Category.UTILITIES);

        List<String> vendors = MerchantCatalog.merchantsFor(Category.SUBSCRIPTIONS);
        int subscriptions = 3 + random.nextInt(4);
        for (int i = 0; i < subscriptions; i++) {
            int day = 1 + random.nextInt(LAST_RANDOM_DAY);
            ledger.expense(day, vendors.get(i % vendors.size()), money(random.uniform(5, 23)), Category.SUBSCRIPTIONS);
        }
    }

    private void addDailySpend(PersonaProfile profile, MonthLedger ledger, double trendMultiplier, RandomSource random) {
        double styleMultiplier = profile.spendingStyle().baseMultiplier();
        for (int day = 1; day <= ledger.month.lengthOfMonth(); day++) {
            LocalDate date = ledger.month.atDay(day);
            double dailyMultiplier = styleMultiplier
                    * TemporalMultipliers.seasonMultiplier(date)
                    * TemporalMultipliers.weekdayMultiplier(date)
                    * trendMultiplier;
            for (DailyRule rule : DAILY_RULES) {
                if (random.chance(rule.chance().applyAsDouble(profile, date))) {
                    BigDecimal amount = money(random.uniform(rule.min(), rule.max()) * dailyMultiplier);
                    ledger.expense(day, MerchantCatalog.pick(rule.category(), random), amount, rule.category());
                }
            }
        }
    }

    private void addTransfers(MonthLedger ledger, RandomSource random) {
        int transfers = random.nextInt(3);
        for (int i = 0; i < transfers; i++) {
            int day = 1 + random.nextInt(LAST_RANDOM_DAY);
            ledger.expense(day, MerchantCatalog.pick(Category.TRANSFER, random),
                    money(random.uniform(20, 120)), Category.TRANSFER);
        }
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    private record DailyRule(Category category, double min, double max, ToDoubleBiFunction<PersonaProfile, LocalDate> chance) {
    }

    private static final class MonthLedger {
        private final YearMonth month;
        private final List<Transaction> sink;
        private GenerationResult.MonthlyTotals totals = GenerationResult.MonthlyTotals.zero();

        private MonthLedger(YearMonth month, List<Transaction> sink) {
            this.month = month;
            this.sink = sink;
        }

        void income(int day, String description, BigDecimal amount) {
            sink.add(new Transaction(month.atDay(day), description, amount, Category.INCOME.label()));
            totals = totals.addIncome(amount);
        }

        void expense(int day, String description, BigDecimal amount, Category category) {
            sink.add(new Transaction(month.atDay(day), description, amount.negate(), category.label()));
            totals = totals.addSpent(amount);
        }
    }
}

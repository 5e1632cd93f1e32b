package com.prophit.insights.synthetic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.prophit.insights.model.AmountRange;
import com.prophit.insights.model.Category;
import com.prophit.insights.model.InvalidConfigurationException;
import com.prophit.insights.model.PersonaProfile;
import com.prophit.insights.model.SpendingStyle;
import com.prophit.insights.model.Transaction;
import com.prophit.insights.model.TrendDirection;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransactionGeneratorTest {

    private static final Instant AS_OF = Instant.parse("2026-02-21T00:00:00Z");
    private static final Set<String> DISCRETIONARY = Set.of(
            "Coffee", "Groceries", "Dining", "Transport", "Shopping", "Entertainment", "Healthcare", "Education"
    );

    private TransactionGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new TransactionGenerator(ZoneOffset.UTC);
    }

    @Test
    void generatesFixedMonthlyItemsForEveryMonthInWindow() {
        Persona persona = persona(SpendingStyle.MODERATE, TrendDirection.STABLE);

        GenerationResult result = generator.generate(persona, GenerationWindow.ofMonths(3), AS_OF, RandomSource.seeded(11));
        List<Transaction> transactions = result.transactions();

        assertThat(count(transactions, "Income")).isEqualTo(3);
        assertThat(count(transactions, "Rent")).isEqualTo(3);
        assertThat(count(transactions, "Utilities")).isEqualTo(3);
        assertThat(count(transactions, "Subscriptions")).isBetween(9L, 18L);
        assertThat(count(transactions, "Transfer")).isBetween(0L, 6L);
        assertThat(transactions)
                .allSatisfy(tx -> assertThat(tx.date()).isBetween(LocalDate.of(2025, 12, 1), LocalDate.of(2026, 2, 28)));
        assertThat(result.monthlyTotals()).hasSize(3);
    }

    @Test
    void incomeIsPositiveAndEverythingElseIsAnOutflow() {
        Persona persona = persona(SpendingStyle.SPENDER, TrendDirection.WORSENING);

        List<Transaction> transactions = generator
                .generate(persona, GenerationWindow.ofMonths(2), AS_OF, RandomSource.seeded(5))
                .transactions();

        assertThat(transactions).allSatisfy(tx -> {
            if ("Income".equals(tx.category())) {
                assertThat(tx.amount()).isBetween(new BigDecimal("2850.00"), new BigDecimal("3150.00"));
                assertThat(tx.date().getDayOfMonth()).isEqualTo(1);
            } else {
                assertThat(tx.isOutflow()).isTrue();
            }
            assertThat(tx.amount().scale()).isEqualTo(2);
        });
    }

    @Test
    void rentIsRoundedToFifty() {
        Persona persona = persona(SpendingStyle.FRUGAL, TrendDirection.IMPROVING);

        List<Transaction> rents = generator
                .generate(persona, GenerationWindow.ofMonths(6), AS_OF, RandomSource.seeded(99))
                .transactions().stream()
                .filter(tx -> "Rent".equals(tx.category()))
                .toList();

        assertThat(rents).hasSize(6).allSatisfy(tx ->
                assertThat(tx.amount().abs().remainder(BigDecimal.valueOf(50))).isEqualByComparingTo(BigDecimal.ZERO));
    }

    @Test
    void transactionsAreSortedMostRecentFirst() {
        List<Transaction> transactions = generator
                .generate(persona(SpendingStyle.MODERATE, TrendDirection.STABLE), GenerationWindow.ofMonths(4), AS_OF, RandomSource.seeded(3))
                .transactions();

        for (int i = 1; i < transactions.size(); i++) {
            assertThat(transactions.get(i).date()).isBeforeOrEqualTo(transactions.get(i - 1).date());
        }
    }

    @Test
    void monthlyTotalsMatchTheGeneratedTransactions() {
        GenerationResult result = generator.generate(
                persona(SpendingStyle.MODERATE, TrendDirection.STABLE), GenerationWindow.ofMonths(3), AS_OF, RandomSource.seeded(21));

        BigDecimal spent = result.transactions().stream()
                .filter(Transaction::isOutflow)
                .map(tx -> tx.amount().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalsSpent = result.monthlyTotals().values().stream()
                .map(GenerationResult.MonthlyTotals::spent)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        assertThat(totalsSpent).isEqualByComparingTo(spent);
    }

    @Test
    void sameSeedProducesSameLedger() {
        Persona persona = persona(SpendingStyle.MODERATE, TrendDirection.IMPROVING);

        List<Transaction> first = generator.generate(persona, GenerationWindow.ofMonths(3), AS_OF, RandomSource.seeded(42)).transactions();
        List<Transaction> second = generator.generate(persona, GenerationWindow.ofMonths(3), AS_OF, RandomSource.seeded(42)).transactions();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void spendingStyleOrdersDiscretionarySpend() {
        GenerationWindow window = GenerationWindow.ofMonths(12);

        BigDecimal frugal = discretionary(generator.generate(persona(SpendingStyle.FRUGAL, TrendDirection.STABLE), window, AS_OF, RandomSource.seeded(2024)).transactions());
        BigDecimal moderate = discretionary(generator.generate(persona(SpendingStyle.MODERATE, TrendDirection.STABLE), window, AS_OF, RandomSource.seeded(2024)).transactions());
        BigDecimal spender = discretionary(generator.generate(persona(SpendingStyle.SPENDER, TrendDirection.STABLE), window, AS_OF, RandomSource.seeded(2024)).transactions());

        assertThat(frugal).isLessThan(moderate);
        assertThat(moderate).isLessThan(spender);
    }

    @Test
    void rejectsWindowThatDrivesTrendMultiplierToZero() {
        Persona persona = persona(SpendingStyle.MODERATE, TrendDirection.WORSENING);

        assertThatThrownBy(() -> generator.generate(persona, GenerationWindow.ofMonths(68), AS_OF, RandomSource.seeded(1)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> GenerationWindow.ofMonths(0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new GenerationWindow(-1, 3)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> AmountRange.of(5000, 3000)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new PersonaProfile(AmountRange.of(1, 2), AmountRange.of(1, 2), null, Set.of(), TrendDirection.STABLE))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> generator.generate(null, GenerationWindow.standard(), AS_OF, RandomSource.seeded(1)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void instantiatedPersonaStaysWithinProfileRanges() {
        PersonaProfile profile = profile(SpendingStyle.MODERATE, TrendDirection.STABLE);
        for (long seed = 0; seed < 20; seed++) {
            Persona persona = Persona.instantiate(profile, RandomSource.seeded(seed));
            assertThat(persona.monthlyIncome()).isBetween(new BigDecimal("2800"), new BigDecimal("3500"));
            assertThat(persona.savings()).isBetween(new BigDecimal("10000"), new BigDecimal("30000"));
        }
    }

    private static Persona persona(SpendingStyle style, TrendDirection trend) {
        return new Persona(profile(style, trend), new BigDecimal("3000"), new BigDecimal("20000"));
    }

    private static PersonaProfile profile(SpendingStyle style, TrendDirection trend) {
        return new PersonaProfile(AmountRange.of(2800, 3500), AmountRange.of(10000, 30000), style, Set.of(Category.DINING), trend);
    }

    private static long count(List<Transaction> transactions, String category) {
        return transactions.stream().filter(tx -> category.equals(tx.category())).count();
    }

    private static BigDecimal discretionary(List<Transaction> transactions) {
        return transactions.stream()
                .filter(tx -> DISCRETIONARY.contains(tx.category()))
                .map(tx -> tx.amount().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}

package com.prophit.insights.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.prophit.insights.model.AmountRange;
import com.prophit.insights.model.Category;
import com.prophit.insights.model.PersonaProfile;
import com.prophit.insights.model.SpendingStyle;
import com.prophit.insights.model.Transaction;
import com.prophit.insights.model.TransactionSummary;
import com.prophit.insights.model.TrendDirection;
import com.prophit.insights.synthetic.GenerationWindow;
import com.prophit.insights.synthetic.Persona;
import com.prophit.insights.synthetic.RandomSource;
import com.prophit.insights.synthetic.TransactionGenerator;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SummaryAssemblerTest {

    private SummaryAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new SummaryAssembler(new AggregationEngine(ZoneOffset.UTC, "Groceries"), new TrendProjectionCalculator());
    }

    @Test
    void emptyLedgerYieldsZeroedSummary() {
        TransactionSummary summary = assembler.summarize(List.of(), Instant.parse("2026-02-21T00:00:00Z"), 4);

        assertThat(summary.totalSpent()).isEqualByComparingTo("0");
        assertThat(summary.totalIncome()).isEqualByComparingTo("0");
        assertThat(summary.topCategories()).isEmpty();
        assertThat(summary.monthlySnapshots()).isEmpty();
        assertThat(summary.runwayMonths()).isEqualByComparingTo("0");
        assertThat(summary.savingsRate()).isZero();
        assertThat(summary.weeklyAverages()).hasSize(4);
        assertThat(summary.dataRangeMonths()).isEqualByComparingTo("1.0");
    }

    @Test
    void singleTransactionUsesOneDayFloor() {
        List<Transaction> ledger = List.of(
                new Transaction(LocalDate.of(2026, 2, 1), "Tesco", new BigDecimal("-50"), "Groceries")
        );

        TransactionSummary summary = assembler.summarize(ledger, Instant.parse("2026-02-01T00:00:00Z"), 4);

        assertThat(summary.totalSpent()).isEqualByComparingTo("50");
        assertThat(summary.topCategories()).containsExactly("Groceries");
        assertThat(summary.avgDaily()).isEqualByComparingTo("50");
        assertThat(summary.avgMonthly()).isEqualByComparingTo("50");
        assertThat(summary.weeklyAverages().get(0).amount()).isEqualByComparingTo("50");
        assertThat(summary.savingsRate()).isZero();
        assertThat(summary.runwayMonths()).isEqualByComparingTo("0");
    }

    @Test
    void summarizingTwiceGivesIdenticalOutput() {
        Instant asOf = Instant.parse("2026-02-21T00:00:00Z");
        PersonaProfile profile = new PersonaProfile(
                AmountRange.of(3000, 4000), AmountRange.of(10000, 20000), SpendingStyle.MODERATE, Set.of(Category.SHOPPING), TrendDirection.WORSENING
        );
        Persona persona = Persona.instantiate(profile, RandomSource.seeded(8));
        List<Transaction> ledger = new TransactionGenerator(ZoneOffset.UTC)
                .generate(persona, GenerationWindow.ofMonths(6), asOf, RandomSource.seeded(8))
                .transactions();

        TransactionSummary first = assembler.summarize(ledger, asOf, 12);
        TransactionSummary second = assembler.summarize(ledger, asOf, 12);

        assertThat(first).isEqualTo(second);
        assertThat(first.runwayMonths().signum()).isGreaterThanOrEqualTo(0);
        assertThat(first.savingsRate()).isBetween(0, 100);
        assertThat(first.monthlySnapshots()).hasSize(6);
        assertThat(first.weeklyAverages()).hasSize(12);
        BigDecimal categorySum = first.categoryTotals().values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(categorySum).isEqualByComparingTo(first.totalSpent());
    }

    @Test
    void zeroIncomeLedgerHasZeroSavingsAndRunway() {
        List<Transaction> ledger = List.of(
                new Transaction(LocalDate.of(2026, 1, 3), "Lidl", new BigDecimal("-20.00"), "Groceries"),
                new Transaction(LocalDate.of(2026, 2, 3), "Lidl", new BigDecimal("-25.00"), "Groceries")
        );

        TransactionSummary summary = assembler.summarize(ledger, Instant.parse("2026-02-21T00:00:00Z"), 4);

        assertThat(summary.savings()).isEqualByComparingTo("0");
        assertThat(summary.runwayMonths()).isEqualByComparingTo("0");
        assertThat(summary.monthlyIncome()).isEqualByComparingTo("0");
    }
}

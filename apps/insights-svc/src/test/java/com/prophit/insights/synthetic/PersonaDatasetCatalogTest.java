package com.prophit.insights.synthetic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.prophit.insights.analytics.AggregationEngine;
import com.prophit.insights.analytics.SummaryAssembler;
import com.prophit.insights.analytics.TrendProjectionCalculator;
import com.prophit.insights.config.InsightsProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class PersonaDatasetCatalogTest {

    private static final Instant AS_OF = Instant.parse("2026-02-21T00:00:00Z");

    @Test
    void buildsConfiguredNumberOfDatasetsWithSequentialIds() {
        PersonaDatasetCatalog catalog = catalog(42L, 3);

        List<SyntheticDataset> datasets = catalog.datasets();

        assertThat(datasets).extracting(SyntheticDataset::id).containsExactly(1, 2, 3);
        assertThat(datasets).allSatisfy(dataset -> {
            assertThat(dataset.transactions()).isNotEmpty();
            assertThat(dataset.summary().monthlySnapshots()).hasSize(3);
            assertThat(dataset.summary().weeklyAverages()).hasSize(12);
            assertThat(dataset.transactions())
                    .allSatisfy(tx -> assertThat(tx.date()).isAfterOrEqualTo(LocalDate.of(2025, 12, 1)));
        });
        assertThat(catalog.datasets()).isSameAs(datasets);
        assertThat(catalog.size()).isEqualTo(3);
    }

    @Test
    void sameSeedBuildsSameCatalog() {
        List<SyntheticDataset> first = catalog(7L, 3).datasets();
        List<SyntheticDataset> second = catalog(7L, 3).datasets();

        for (int i = 0; i < first.size(); i++) {
            assertThat(first.get(i).transactions()).isEqualTo(second.get(i).transactions());
            assertThat(first.get(i).persona()).isEqualTo(second.get(i).persona());
        }
    }

    @Test
    void lookupIsBoundedByDatasetCount() {
        PersonaDatasetCatalog catalog = catalog(1L, 2);

        assertThat(catalog.findById(0)).isEmpty();
        assertThat(catalog.findById(3)).isEmpty();
        assertThat(catalog.findById(2)).hasValueSatisfying(dataset -> assertThat(dataset.id()).isEqualTo(2));
    }

    @Test
    void availableIdsSkipUsedOnes() {
        PersonaDatasetCatalog catalog = catalog(1L, 3);

        assertThat(catalog.availableIds(List.of(2))).containsExactly(1, 3);
        assertThat(catalog.randomAvailableId(List.of(1, 3), RandomSource.seeded(5))).hasValue(2);
        assertThat(catalog.randomAvailableId(List.of(1, 2, 3), RandomSource.seeded(5))).isEmpty();
    }

    @Test
    void rejectsEmptyTemplateList() {
        InsightsProperties properties = properties(1L, 1);
        assertThatThrownBy(() -> new PersonaDatasetCatalog(
                new TransactionGenerator(ZoneOffset.UTC), assembler(), List.of(), properties, Clock.fixed(AS_OF, ZoneOffset.UTC)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static PersonaDatasetCatalog catalog(long seed, int count) {
        InsightsProperties properties = properties(seed, count);
        return new PersonaDatasetCatalog(
                new TransactionGenerator(ZoneOffset.UTC),
                assembler(),
                properties,
                Clock.fixed(AS_OF, ZoneOffset.UTC)
        );
    }

    private static InsightsProperties properties(long seed, int count) {
        return new InsightsProperties(
                new InsightsProperties.Anchor(AS_OF, "UTC"),
                new InsightsProperties.Generator(3, seed, count),
                new InsightsProperties.Summary(4, 12, "Groceries")
        );
    }

    private static SummaryAssembler assembler() {
        return new SummaryAssembler(new AggregationEngine(ZoneOffset.UTC, "Groceries"), new TrendProjectionCalculator());
    }
}

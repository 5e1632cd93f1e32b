package com.prophit.insights.synthetic;

import com.prophit.insights.analytics.SummaryAssembler;
import com.prophit.insights.config.InsightsProperties;
import com.prophit.insights.model.PersonaProfile;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Demo datasets generated once, on first use, and shared read-only afterwards. Each dataset has
 * its own random source derived from the catalog seed and the dataset id, so the catalog is
 * reproducible for a given seed regardless of how the build is scheduled.
 */
@Component
public class PersonaDatasetCatalog {

    private static final Logger log = LoggerFactory.getLogger(PersonaDatasetCatalog.class);
    private static final long ID_MIX = 0x9E3779B97F4A7C15L;

    private final TransactionGenerator generator;
    private final SummaryAssembler summaryAssembler;
    private final List<PersonaProfile> templates;
    private final Clock clock;
    private final InsightsProperties.Generator settings;
    private final int syntheticWeeks;
    private final long baseSeed;

    private volatile List<SyntheticDataset> datasets;

    @Autowired
    public PersonaDatasetCatalog(
            TransactionGenerator generator,
            SummaryAssembler summaryAssembler,
            InsightsProperties properties,
            Clock clock
    ) {
        this(generator, summaryAssembler, PersonaTemplates.defaults(), properties, clock);
    }

    PersonaDatasetCatalog(
            TransactionGenerator generator,
            SummaryAssembler summaryAssembler,
            List<PersonaProfile> templates,
            InsightsProperties properties,
            Clock clock
    ) {
        if (templates == null || templates.isEmpty()) {
            throw new IllegalArgumentException("at least one persona template is required");
        }
        this.generator = generator;
        this.summaryAssembler = summaryAssembler;
        this.templates = List.copyOf(templates);
        this.clock = clock;
        this.settings = properties.generator();
        this.syntheticWeeks = properties.summary().syntheticWeeks();
        this.baseSeed = settings.seeded() ? settings.seed() : RandomSource.entropy().nextInt(Integer.MAX_VALUE);
    }

    public List<SyntheticDataset> datasets() {
        List<SyntheticDataset> current = datasets;
        if (current == null) {
            synchronized (this) {
                current = datasets;
                if (current == null) {
                    current = build();
                    datasets = current;
                }
            }
        }
        return current;
    }

    public Optional<SyntheticDataset> findById(int id) {
        if (id < 1 || id > settings.datasetCount()) {
            return Optional.empty();
        }
        return Optional.of(datasets().get(id - 1));
    }

    public List<Integer> availableIds(Collection<Integer> usedIds) {
        Set<Integer> used = usedIds == null ? Set.of() : Set.copyOf(usedIds);
        return IntStream.rangeClosed(1, settings.datasetCount())
                .boxed()
                .filter(id -> !used.contains(id))
                .toList();
    }

    public OptionalInt randomAvailableId(Collection<Integer> usedIds, RandomSource random) {
        List<Integer> available = availableIds(usedIds);
        if (available.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(random.pick(available));
    }

    public int size() {
        return settings.datasetCount();
    }

    private List<SyntheticDataset> build() {
        Instant asOf = clock.instant();
        GenerationWindow window = GenerationWindow.ofMonths(settings.windowMonths());
        long started = System.nanoTime();
        List<SyntheticDataset> built = IntStream.rangeClosed(1, settings.datasetCount())
                .parallel()
                .mapToObj(id -> buildDataset(id, window, asOf))
                .toList();
        log.info("Persona catalog built: datasets={}, windowMonths={}, asOf={}, seeded={}, elapsedMs={}",
                built.size(), window.lengthMonths(), asOf, settings.seeded(), (System.nanoTime() - started) / 1_000_000);
        return built;
    }

    private SyntheticDataset buildDataset(int id, GenerationWindow window, Instant asOf) {
        RandomSource random = RandomSource.seeded(baseSeed ^ (id * ID_MIX));
        PersonaProfile profile = templates.get((id - 1) % templates.size());
        Persona persona = Persona.instantiate(profile, random);
        GenerationResult result = generator.generate(persona, window, asOf, random);
        return new SyntheticDataset(
                id,
                persona,
                result.transactions(),
                summaryAssembler.summarize(result.transactions(), asOf, syntheticWeeks)
        );
    }
}

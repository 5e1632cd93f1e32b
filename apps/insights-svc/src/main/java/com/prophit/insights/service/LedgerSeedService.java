package com.prophit.insights.service;

import com.prophit.insights.repository.StoredTransaction;
import com.prophit.insights.repository.TransactionRepository;
import com.prophit.insights.synthetic.PersonaDatasetCatalog;
import com.prophit.insights.synthetic.RandomSource;
import com.prophit.insights.synthetic.SyntheticDataset;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Hands out demo datasets to ledgers and copies the dataset's transactions into the ledger.
 */
@Service
public class LedgerSeedService {

    private static final Logger log = LoggerFactory.getLogger(LedgerSeedService.class);

    public record SeedResult(int datasetId, int seededCount, boolean reused, boolean fallback) {
    }

    private final PersonaDatasetCatalog catalog;
    private final TransactionRepository transactionRepository;
    private final Clock clock;
    private final RandomSource random;
    private final Map<UUID, Integer> assignments = new ConcurrentHashMap<>();

    @Autowired
    public LedgerSeedService(PersonaDatasetCatalog catalog, TransactionRepository transactionRepository, Clock clock) {
        this(catalog, transactionRepository, clock, RandomSource.entropy());
    }

    LedgerSeedService(PersonaDatasetCatalog catalog, TransactionRepository transactionRepository, Clock clock, RandomSource random) {
        this.catalog = catalog;
        this.transactionRepository = transactionRepository;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Assigns an unused dataset to the ledger and replaces the ledger's seeded rows with it; manual
     * entries are kept. A ledger that already has a dataset keeps it. When every dataset is taken,
     * a random one is shared.
     */
    public synchronized SeedResult seed(UUID ledgerId) {
        if (ledgerId == null) {
            throw new IllegalArgumentException("ledgerId must be provided");
        }
        Integer existing = assignments.get(ledgerId);
        boolean reused = existing != null;
        boolean fallback = false;
        int datasetId;
        if (reused) {
            datasetId = existing;
        } else {
            OptionalInt available = catalog.randomAvailableId(assignments.values(), random);
            if (available.isPresent()) {
                datasetId = available.getAsInt();
            } else {
                log.warn("No unassigned datasets left for ledger {}; sharing a random dataset", ledgerId);
                datasetId = 1 + random.nextInt(catalog.size());
                fallback = true;
            }
            assignments.put(ledgerId, datasetId);
        }

        int resolvedId = datasetId;
        SyntheticDataset dataset = catalog.findById(resolvedId)
                .orElseThrow(() -> new IllegalArgumentException("Dataset not found: " + resolvedId));
        Instant now = clock.instant();
        List<StoredTransaction> rows = dataset.transactions().stream()
                .map(tx -> new StoredTransaction(UUID.randomUUID(), ledgerId, tx, now, false))
                .toList();
        transactionRepository.deleteSeededByLedgerId(ledgerId);
        transactionRepository.saveAll(rows);
        log.info("Seeded ledger {} with dataset {} ({} transactions, reused={}, fallback={})",
                ledgerId, datasetId, rows.size(), reused, fallback);
        return new SeedResult(datasetId, rows.size(), reused, fallback);
    }

    /**
     * Drops the ledger's dataset assignment and its seeded rows so the dataset can be handed out
     * again. Manual entries stay.
     */
    public synchronized boolean release(UUID ledgerId) {
        if (ledgerId == null) {
            throw new IllegalArgumentException("ledgerId must be provided");
        }
        Integer released = assignments.remove(ledgerId);
        if (released == null) {
            log.warn("Release requested for ledger {} without a dataset", ledgerId);
            return false;
        }
        int removed = transactionRepository.deleteSeededByLedgerId(ledgerId);
        log.info("Released dataset {} from ledger {} ({} seeded transactions removed)", released, ledgerId, removed);
        return true;
    }

    public Optional<Integer> assignedDataset(UUID ledgerId) {
        return Optional.ofNullable(assignments.get(ledgerId));
    }
}

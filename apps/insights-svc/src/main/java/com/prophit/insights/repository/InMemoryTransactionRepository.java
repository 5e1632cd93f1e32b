package com.prophit.insights.repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTransactionRepository implements TransactionRepository {

    private static final Comparator<StoredTransaction> MOST_RECENT_FIRST =
            Comparator.comparing((StoredTransaction stored) -> stored.transaction().date())
                    .thenComparing(StoredTransaction::createdAt)
                    .thenComparing(StoredTransaction::id)
                    .reversed();

    private final Map<UUID, StoredTransaction> storage = new ConcurrentHashMap<>();

    @Override
    public StoredTransaction save(StoredTransaction transaction) {
        storage.put(transaction.id(), transaction);
        return transaction;
    }

    @Override
    public List<StoredTransaction> saveAll(List<StoredTransaction> transactions) {
        transactions.forEach(this::save);
        return List.copyOf(transactions);
    }

    @Override
    public List<StoredTransaction> findByLedgerId(UUID ledgerId) {
        return storage.values().stream()
                .filter(stored -> stored.ledgerId().equals(ledgerId))
                .sorted(MOST_RECENT_FIRST)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<StoredTransaction> findByLedgerIdAndRange(UUID ledgerId, LocalDate fromInclusive, LocalDate toInclusive) {
        return findByLedgerId(ledgerId).stream()
                .filter(stored -> {
                    LocalDate date = stored.transaction().date();
                    return !date.isBefore(fromInclusive) && !date.isAfter(toInclusive);
                })
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<StoredTransaction> findById(UUID transactionId) {
        return Optional.ofNullable(storage.get(transactionId));
    }

    @Override
    public boolean deleteById(UUID transactionId) {
        return storage.remove(transactionId) != null;
    }

    @Override
    public void deleteByLedgerId(UUID ledgerId) {
        storage.entrySet().removeIf(entry -> entry.getValue().ledgerId().equals(ledgerId));
    }

    @Override
    public int deleteSeededByLedgerId(UUID ledgerId) {
        List<UUID> seeded = storage.values().stream()
                .filter(stored -> stored.ledgerId().equals(ledgerId) && !stored.manual())
                .map(StoredTransaction::id)
                .toList();
        seeded.forEach(storage::remove);
        return seeded.size();
    }
}

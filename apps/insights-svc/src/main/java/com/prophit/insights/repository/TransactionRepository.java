package com.prophit.insights.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TransactionRepository {

    StoredTransaction save(StoredTransaction transaction);

    List<StoredTransaction> saveAll(List<StoredTransaction> transactions);

    List<StoredTransaction> findByLedgerId(UUID ledgerId);

    List<StoredTransaction> findByLedgerIdAndRange(UUID ledgerId, LocalDate fromInclusive, LocalDate toInclusive);

    Optional<StoredTransaction> findById(UUID transactionId);

    boolean deleteById(UUID transactionId);

    void deleteByLedgerId(UUID ledgerId);

    /**
     * Removes the ledger's seeded rows and leaves manually entered ones in place.
     */
    int deleteSeededByLedgerId(UUID ledgerId);
}

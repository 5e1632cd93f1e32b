package com.prophit.insights.repository;

import com.prophit.insights.model.Transaction;
import java.time.Instant;
import java.util.UUID;

/**
 * A transaction as held by a ledger source, with the bookkeeping the engine itself ignores.
 */
public record StoredTransaction(
        UUID id,
        UUID ledgerId,
        Transaction transaction,
        Instant createdAt,
        boolean manual
) {
}

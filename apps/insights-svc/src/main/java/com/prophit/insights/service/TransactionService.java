package com.prophit.insights.service;

import com.prophit.insights.analytics.SummaryAssembler;
import com.prophit.insights.config.InsightsProperties;
import com.prophit.insights.model.Category;
import com.prophit.insights.model.Transaction;
import com.prophit.insights.model.TransactionSummary;
import com.prophit.insights.repository.StoredTransaction;
import com.prophit.insights.repository.TransactionRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionRepository transactionRepository;
    private final SummaryAssembler summaryAssembler;
    private final Clock clock;
    private final int liveWeeks;

    public TransactionService(
            TransactionRepository transactionRepository,
            SummaryAssembler summaryAssembler,
            Clock clock,
            InsightsProperties properties
    ) {
        this.transactionRepository = transactionRepository;
        this.summaryAssembler = summaryAssembler;
        this.clock = clock;
        this.liveWeeks = properties.summary().liveWeeks();
    }

    /**
     * Records a manually entered transaction, guessing the category from the description when
     * none is given. Known labels are normalised to their canonical spelling; custom labels are kept.
     */
    public StoredTransaction addTransaction(UUID ledgerId, Transaction draft) {
        if (ledgerId == null) {
            throw new IllegalArgumentException("ledgerId must be provided");
        }
        if (draft == null) {
            throw new IllegalArgumentException("transaction must be provided");
        }
        Transaction transaction = draft;
        Category known = Category.fromLabel(draft.category());
        if (known != Category.OTHER) {
            transaction = draft.withCategory(known.label());
        } else if (Category.OTHER.label().equalsIgnoreCase(draft.category().trim())) {
            Category guessed = TransactionCategorizer.categorize(draft.description());
            transaction = draft.withCategory(guessed.label());
        }
        StoredTransaction stored = transactionRepository.save(
                new StoredTransaction(UUID.randomUUID(), ledgerId, transaction, clock.instant(), true)
        );
        log.info("Added transaction {} to ledger {}: category={}, amount={}",
                stored.id(), ledgerId, transaction.category(), transaction.amount());
        return stored;
    }

    public boolean deleteTransaction(UUID transactionId) {
        boolean removed = transactionRepository.deleteById(transactionId);
        if (!removed) {
            log.warn("Delete requested for unknown transaction {}", transactionId);
        }
        return removed;
    }

    public List<Transaction> listTransactions(UUID ledgerId) {
        return transactionRepository.findByLedgerId(ledgerId).stream()
                .map(StoredTransaction::transaction)
                .toList();
    }

    public List<Transaction> transactionsInRange(UUID ledgerId, LocalDate fromInclusive, LocalDate toInclusive) {
        if (fromInclusive.isAfter(toInclusive)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return transactionRepository.findByLedgerIdAndRange(ledgerId, fromInclusive, toInclusive).stream()
                .map(StoredTransaction::transaction)
                .toList();
    }

    /**
     * Outflows in the range, transfers excluded.
     */
    public BigDecimal spendingInRange(UUID ledgerId, LocalDate fromInclusive, LocalDate toInclusive) {
        return transactionsInRange(ledgerId, fromInclusive, toInclusive).stream()
                .filter(TransactionService::isSpending)
                .map(tx -> tx.amount().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public Map<String, BigDecimal> spendingByCategory(UUID ledgerId, LocalDate fromInclusive, LocalDate toInclusive) {
        Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
        transactionsInRange(ledgerId, fromInclusive, toInclusive).stream()
                .filter(TransactionService::isSpending)
                .forEach(tx -> byCategory.merge(tx.category(), tx.amount().abs(), BigDecimal::add));
        byCategory.replaceAll((category, amount) -> amount.setScale(2, RoundingMode.HALF_UP));
        return byCategory;
    }

    public TransactionSummary summarize(UUID ledgerId) {
        return summaryAssembler.summarize(listTransactions(ledgerId), clock.instant(), liveWeeks);
    }

    private static boolean isSpending(Transaction transaction) {
        return transaction.isOutflow() && !Category.TRANSFER.label().equals(transaction.category());
    }
}

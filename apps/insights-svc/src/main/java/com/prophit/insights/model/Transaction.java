package com.prophit.insights.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;
import java.util.Optional;

/**
 * A single dated money movement. Negative amounts are outflows, positive amounts inflows.
 */
public record Transaction(
        LocalDate date,
        String description,
        BigDecimal amount,
        String category,
        Optional<Instant> timestamp
) {
    public Transaction {
        Objects.requireNonNull(date, "date must be provided");
        Objects.requireNonNull(amount, "amount must be provided");
        description = description == null ? "" : description;
        category = category == null || category.isBlank() ? Category.OTHER.label() : category;
        timestamp = timestamp == null ? Optional.empty() : timestamp;
    }

    public Transaction(LocalDate date, String description, BigDecimal amount, String category) {
        this(date, description, amount, category, Optional.empty());
    }

    public boolean isOutflow() {
        return amount.signum() < 0;
    }

    public boolean isInflow() {
        return amount.signum() > 0;
    }

    public YearMonth month() {
        return YearMonth.from(date);
    }

    public Transaction withCategory(String newCategory) {
        return new Transaction(date, description, amount, newCategory, timestamp);
    }
}

package com.prophit.insights.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record MonthlySnapshot(
        YearMonth month,
        BigDecimal totalSpent,
        BigDecimal totalIncome,
        BigDecimal netSavings,
        String topCategory
) {
}

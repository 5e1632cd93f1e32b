package com.prophit.insights.synthetic;

import com.prophit.insights.model.Transaction;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

public record GenerationResult(
        Persona persona,
        List<Transaction> transactions,
        Map<YearMonth, MonthlyTotals> monthlyTotals
) {
    public record MonthlyTotals(BigDecimal spent, BigDecimal income) {

        static MonthlyTotals zero() {
            return new MonthlyTotals(BigDecimal.ZERO, BigDecimal.ZERO);
        }

        MonthlyTotals addSpent(BigDecimal amount) {
            return new MonthlyTotals(spent.add(amount), income);
        }

        MonthlyTotals addIncome(BigDecimal amount) {
            return new MonthlyTotals(spent, income.add(amount));
        }
    }
}

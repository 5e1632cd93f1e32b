package com.prophit.insights.model;

import java.util.EnumSet;
import java.util.Set;

public record PersonaProfile(
        AmountRange incomeRange,
        AmountRange savingsRange,
        SpendingStyle spendingStyle,
        Set<Category> focusCategories,
        TrendDirection trendDirection
) {
    public PersonaProfile {
        if (incomeRange == null) {
            throw new InvalidConfigurationException("incomeRange must be provided");
        }
        if (savingsRange == null) {
            throw new InvalidConfigurationException("savingsRange must be provided");
        }
        if (spendingStyle == null) {
            throw new InvalidConfigurationException("spendingStyle must be provided");
        }
        if (trendDirection == null) {
            throw new InvalidConfigurationException("trendDirection must be provided");
        }
        focusCategories = focusCategories == null || focusCategories.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(focusCategories));
    }

    public boolean focusesOn(Category category) {
        return focusCategories.contains(category);
    }
}

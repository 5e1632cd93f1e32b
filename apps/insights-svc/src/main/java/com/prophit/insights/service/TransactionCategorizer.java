package com.prophit.insights.service;

import com.prophit.insights.model.Category;
import java.util.List;
import java.util.Locale;

/**
 * Keyword-based category guess for manually entered transactions. First matching rule wins.
 */
public final class TransactionCategorizer {

    private static final List<Rule> RULES = List.of(
            new Rule(Category.COFFEE, "coffee", "starbucks", "costa", "cafe"),
            new Rule(Category.TRANSPORT, "uber", "bolt", "taxi", "luas", "bus", "dart"),
            new Rule(Category.GROCERIES, "tesco", "lidl", "aldi", "dunnes", "supermarket", "grocery", "supervalu"),
            new Rule(Category.SUBSCRIPTIONS, "netflix", "spotify", "disney", "subscription", "apple", "youtube"),
            new Rule(Category.DINING, "restaurant", "dining", "food", "lunch", "dinner", "breakfast", "eat"),
            new Rule(Category.RENT, "rent", "landlord", "accommodation"),
            new Rule(Category.UTILITIES, "electric", "gas", "water", "utility", "bord gais", "energia"),
            new Rule(Category.SHOPPING, "amazon", "shop", "store", "penneys", "zara", "h&m"),
            new Rule(Category.INCOME, "salary", "payroll", "income", "deposit", "wages"),
            new Rule(Category.TRANSFER, "transfer", "revolut", "sent", "received"),
            new Rule(Category.ENTERTAINMENT, "drink", "pub", "bar", "beer", "wine")
    );

    private TransactionCategorizer() {
    }

    public static Category categorize(String description) {
        if (description == null || description.isBlank()) {
            return Category.OTHER;
        }
        String normalized = description.toLowerCase(Locale.ROOT);
        return RULES.stream()
                .filter(rule -> rule.matches(normalized))
                .map(Rule::category)
                .findFirst()
                .orElse(Category.OTHER);
    }

    private record Rule(Category category, List<String> keywords) {
        Rule(Category category, String... keywords) {
            this(category, List.of(keywords));
        }

        boolean matches(String normalized) {
            return keywords.stream().anyMatch(normalized::contains);
        }
    }
}

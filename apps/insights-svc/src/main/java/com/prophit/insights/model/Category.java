package com.prophit.insights.model;

import java.util.Locale;

public enum Category {
    COFFEE("Coffee"),
    GROCERIES("Groceries"),
    DINING("Dining"),
    TRANSPORT("Transport"),
    SHOPPING("Shopping"),
    SUBSCRIPTIONS("Subscriptions"),
    UTILITIES("Utilities"),
    ENTERTAINMENT("Entertainment"),
    RENT("Rent"),
    TRANSFER("Transfer"),
    HEALTHCARE("Healthcare"),
    EDUCATION("Education"),
    INCOME("Income"),
    OTHER("Other");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a free-text label case-insensitively; anything unrecognised is {@link #OTHER}.
     */
    public static Category fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return category;
            }
        }
        return OTHER;
    }
}

package com.prophit.insights.model;

/**
 * How freely a persona spends on discretionary categories.
 */
public enum SpendingStyle {
    FRUGAL(0.55, 0.25, 0.12),
    MODERATE(0.85, 0.50, 0.22),
    SPENDER(1.2, 0.75, 0.38);

    private final double baseMultiplier;
    private final double coffeeChance;
    private final double diningChance;

    SpendingStyle(double baseMultiplier, double coffeeChance, double diningChance) {
        this.baseMultiplier = baseMultiplier;
        this.coffeeChance = coffeeChance;
        this.diningChance = diningChance;
    }

    public double baseMultiplier() {
        return baseMultiplier;
    }

    public double coffeeChance() {
        return coffeeChance;
    }

    public double diningChance() {
        return diningChance;
    }
}

package com.prophit.insights.synthetic;

import java.time.LocalDate;

/**
 * Calendar-driven spending bumps layered onto base amounts.
 */
public final class TemporalMultipliers {

    private TemporalMultipliers() {
    }

    public static double seasonMultiplier(LocalDate date) {
        return switch (date.getMonth()) {
            case DECEMBER, JANUARY -> 1.3;
            case JULY, AUGUST -> 1.15;
            case FEBRUARY, MARCH -> 0.9;
            default -> 1.0;
        };
    }

    public static double weekdayMultiplier(LocalDate date) {
        return switch (date.getDayOfWeek()) {
            case FRIDAY -> 1.4;
            case SATURDAY -> 1.3;
            case SUNDAY -> 1.1;
            default -> 1.0;
        };
    }
}

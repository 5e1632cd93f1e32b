package com.prophit.insights.model;

import java.util.Locale;

public enum SpendingTrend {
    INCREASING,
    DECREASING,
    STABLE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

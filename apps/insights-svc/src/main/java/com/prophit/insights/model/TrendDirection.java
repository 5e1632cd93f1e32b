package com.prophit.insights.model;

/**
 * Direction a persona's spending drifts over the generated history.
 * {@code monthOffset} counts months before the end of the window (0 = most recent).
 */
public enum TrendDirection {
    IMPROVING {
        @Override
        public double multiplier(int monthOffset) {
            return 1 + monthOffset * 0.02;
        }
    },
    WORSENING {
        @Override
        public double multiplier(int monthOffset) {
            return 1 - monthOffset * 0.015;
        }
    },
    STABLE {
        @Override
        public double multiplier(int monthOffset) {
            return 1;
        }
    };

    public abstract double multiplier(int monthOffset);
}

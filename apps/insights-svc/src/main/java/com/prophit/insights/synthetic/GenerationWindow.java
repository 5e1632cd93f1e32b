package com.prophit.insights.synthetic;

import com.prophit.insights.model.InvalidConfigurationException;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Whole calendar months to generate, counted back from the as-of month.
 */
public record GenerationWindow(int startOffsetMonths, int lengthMonths) {

    public static final int DEFAULT_LENGTH_MONTHS = 24;

    public GenerationWindow {
        if (startOffsetMonths < 0) {
            throw new InvalidConfigurationException("startOffsetMonths must not be negative: " + startOffsetMonths);
        }
        if (lengthMonths <= 0) {
            throw new InvalidConfigurationException("lengthMonths must be positive: " + lengthMonths);
        }
    }

    public static GenerationWindow ofMonths(int lengthMonths) {
        return new GenerationWindow(0, lengthMonths);
    }

    public static GenerationWindow standard() {
        return ofMonths(DEFAULT_LENGTH_MONTHS);
    }

    /**
     * Months covered by the window, most recent first; index equals the month offset.
     */
    public List<YearMonth> months(YearMonth asOfMonth) {
        YearMonth end = asOfMonth.minusMonths(startOffsetMonths);
        List<YearMonth> months = new ArrayList<>(lengthMonths);
        for (int offset = 0; offset < lengthMonths; offset++) {
            months.add(end.minusMonths(offset));
        }
        return months;
    }
}

package com.prophit.insights.synthetic;

import static com.prophit.insights.model.Category.COFFEE;
import static com.prophit.insights.model.Category.DINING;
import static com.prophit.insights.model.Category.EDUCATION;
import static com.prophit.insights.model.Category.ENTERTAINMENT;
import static com.prophit.insights.model.Category.GROCERIES;
import static com.prophit.insights.model.Category.HEALTHCARE;
import static com.prophit.insights.model.Category.SHOPPING;
import static com.prophit.insights.model.Category.TRANSPORT;
import static com.prophit.insights.model.SpendingStyle.FRUGAL;
import static com.prophit.insights.model.SpendingStyle.MODERATE;
import static com.prophit.insights.model.SpendingStyle.SPENDER;
import static com.prophit.insights.model.TrendDirection.IMPROVING;
import static com.prophit.insights.model.TrendDirection.STABLE;
import static com.prophit.insights.model.TrendDirection.WORSENING;

import com.prophit.insights.model.AmountRange;
import com.prophit.insights.model.Category;
import com.prophit.insights.model.PersonaProfile;
import com.prophit.insights.model.SpendingStyle;
import com.prophit.insights.model.TrendDirection;
import java.util.List;
import java.util.Set;

/**
 * Built-in persona mix used to populate the demo dataset catalog.
 */
public final class PersonaTemplates {

    private static final List<PersonaProfile> DEFAULTS = List.of(
            // frugal savers
            profile(2200, 2800, 20000, 45000, FRUGAL, Set.of(GROCERIES), IMPROVING),
            profile(2500, 3200, 25000, 50000, FRUGAL, Set.of(TRANSPORT), STABLE),
            profile(3000, 3800, 30000, 60000, FRUGAL, Set.of(), IMPROVING),
            profile(2800, 3500, 22000, 48000, FRUGAL, Set.of(HEALTHCARE), STABLE),
            profile(3200, 4000, 35000, 65000, FRUGAL, Set.of(EDUCATION), IMPROVING),
            // moderate, balanced
            profile(2800, 3500, 10000, 28000, MODERATE, Set.of(COFFEE, DINING), STABLE),
            profile(3200, 4000, 14000, 32000, MODERATE, Set.of(SHOPPING), IMPROVING),
            profile(3500, 4500, 16000, 38000, MODERATE, Set.of(ENTERTAINMENT), WORSENING),
            profile(3000, 3800, 12000, 30000, MODERATE, Set.of(DINING, ENTERTAINMENT), STABLE),
            profile(3800, 4800, 18000, 42000, MODERATE, Set.of(), IMPROVING),
            profile(4000, 5000, 20000, 48000, MODERATE, Set.of(SHOPPING, DINING), STABLE),
            profile(4200, 5200, 22000, 50000, MODERATE, Set.of(TRANSPORT), WORSENING),
            profile(3600, 4400, 15000, 35000, MODERATE, Set.of(COFFEE), IMPROVING),
            // big spenders
            profile(3500, 4500, 4000, 15000, SPENDER, Set.of(DINING, ENTERTAINMENT), WORSENING),
            profile(4000, 5200, 6000, 18000, SPENDER, Set.of(SHOPPING, COFFEE), STABLE),
            profile(4500, 5800, 8000, 22000, SPENDER, Set.of(ENTERTAINMENT, SHOPPING), WORSENING),
            profile(5000, 6500, 10000, 28000, SPENDER, Set.of(DINING), IMPROVING),
            profile(3800, 4800, 5000, 16000, SPENDER, Set.of(), WORSENING),
            profile(5500, 7000, 12000, 30000, SPENDER, Set.of(SHOPPING, ENTERTAINMENT), STABLE),
            // high earners
            profile(5500, 7000, 40000, 80000, FRUGAL, Set.of(), IMPROVING),
            profile(6000, 8000, 25000, 55000, MODERATE, Set.of(DINING, SHOPPING), STABLE),
            profile(6500, 8500, 15000, 40000, SPENDER, Set.of(ENTERTAINMENT, DINING), WORSENING),
            profile(5000, 6500, 35000, 70000, FRUGAL, Set.of(EDUCATION), IMPROVING)
    );

    private PersonaTemplates() {
    }

    public static List<PersonaProfile> defaults() {
        return DEFAULTS;
    }

    private static PersonaProfile profile(
            long incomeMin,
            long incomeMax,
            long savingsMin,
            long savingsMax,
            SpendingStyle style,
            Set<Category> focus,
            TrendDirection trend
    ) {
        return new PersonaProfile(AmountRange.of(incomeMin, incomeMax), AmountRange.of(savingsMin, savingsMax), style, focus, trend);
    }
}

package com.prophit.insights.synthetic;

import com.prophit.insights.model.AmountRange;
import com.prophit.insights.model.PersonaProfile;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A profile instantiated with concrete figures. Income and savings are sampled once and
 * stay fixed for everything generated from this persona.
 */
public record Persona(PersonaProfile profile, BigDecimal monthlyIncome, BigDecimal savings) {

    public static Persona instantiate(PersonaProfile profile, RandomSource random) {
        return new Persona(profile, sample(profile.incomeRange(), random), sample(profile.savingsRange(), random));
    }

    private static BigDecimal sample(AmountRange range, RandomSource random) {
        double value = random.uniform(range.min().doubleValue(), range.max().doubleValue());
        return BigDecimal.valueOf(value).setScale(0, RoundingMode.FLOOR);
    }
}

package com.microsoft.capacityadvisor.domain.model;

import java.math.BigDecimal;

/**
 * Monthly savings boundaries between the LOW, MEDIUM and HIGH bands.
 * Lower bounds are inclusive.
 */
public record SavingsThresholds(BigDecimal medium, BigDecimal high) {

    public static final SavingsThresholds DEFAULT =
            new SavingsThresholds(BigDecimal.valueOf(2000), BigDecimal.valueOf(10000));

    public SavingsThresholds {
        if (medium == null || high == null) {
            throw new IllegalArgumentException("Savings thresholds must both be set");
        }
        if (medium.signum() < 0 || medium.compareTo(high) > 0) {
            throw new IllegalArgumentException(
                    "Savings thresholds must satisfy 0 <= medium <= high, got medium=" + medium + ", high=" + high);
        }
    }

    public SavingsBand bandFor(BigDecimal monthlySavings) {
        if (monthlySavings.compareTo(high) >= 0) {
            return SavingsBand.HIGH;
        }
        if (monthlySavings.compareTo(medium) >= 0) {
            return SavingsBand.MEDIUM;
        }
        return SavingsBand.LOW;
    }
}

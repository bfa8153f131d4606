package com.microsoft.capacityadvisor.report;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Dollar formatting shared by finding summaries and the text report.
 * Whole amounts print without cents: $1,168 and $12.50.
 */
public final class Money {

    private Money() {
    }

    public static String format(BigDecimal amount) {
        if (amount == null) {
            return "$0";
        }
        BigDecimal cents = amount.setScale(2, RoundingMode.HALF_UP);
        String pattern = cents.stripTrailingZeros().scale() <= 0 ? "%,.0f" : "%,.2f";
        String formatted = String.format(Locale.US, pattern, cents.abs());
        return (cents.signum() < 0 ? "-$" : "$") + formatted;
    }
}

package com.microsoft.capacityadvisor.pricing;

import java.math.BigDecimal;

/**
 * Monthly cost of a configuration.
 *
 * estimated is true when no catalog entry matched the tier and SKU and the
 * value is a fallback. Totals built from estimated costs are best-effort.
 */
public record CostEstimate(BigDecimal monthlyCost, boolean estimated) {

    public static CostEstimate exact(BigDecimal monthlyCost) {
        return new CostEstimate(monthlyCost, false);
    }

    public static CostEstimate estimate(BigDecimal monthlyCost) {
        return new CostEstimate(monthlyCost, true);
    }
}

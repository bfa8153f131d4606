package com.microsoft.capacityadvisor.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * A candidate configuration for one resource with its projected utilization,
 * risk rating and cost.
 *
 * monthlySavings is relative to the CURRENT option of the same resource.
 * costEstimated is set when the price came from a fallback estimate rather
 * than a registered catalog entry.
 */
@Builder(toBuilder = true)
public record OptimizationOption(
        OptionKind kind,
        ResourceConfiguration configuration,
        String description,
        RiskLevel riskLevel,
        int confidence,
        UtilizationSample projected,
        BigDecimal monthlyCost,
        BigDecimal monthlySavings,
        boolean costEstimated
) {

    @JsonIgnore
    public boolean isCurrent() {
        return kind == OptionKind.CURRENT;
    }

    public boolean hasSavings() {
        return monthlySavings != null && monthlySavings.signum() > 0;
    }
}

package com.microsoft.capacityadvisor.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Everything known about one resource after analysis: its current state,
 * every generated option (CURRENT first) and the option the strategy picked.
 *
 * potentialMonthlySavings equals the selected option's savings for
 * RIGHTSIZING and the full current cost for EMPTY_RESOURCE.
 */
@Builder
public record Recommendation(
        String resourceId,
        String resourceName,
        String resourceGroup,
        RecommendationType type,
        ResourceConfiguration currentConfiguration,
        UtilizationSample currentUtilization,
        Integer workloadCount,
        Integer runningWorkloadCount,
        List<OptimizationOption> options,
        OptimizationOption selectedOption,
        String strategy,
        BigDecimal currentMonthlyCost,
        BigDecimal potentialMonthlySavings
) {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    public Recommendation {
        options = List.copyOf(options);
    }

    @JsonProperty("potentialAnnualSavings")
    public BigDecimal potentialAnnualSavings() {
        return potentialMonthlySavings.multiply(MONTHS_PER_YEAR);
    }

    @JsonProperty("recommendedMonthlyCost")
    public BigDecimal recommendedMonthlyCost() {
        return currentMonthlyCost.subtract(potentialMonthlySavings);
    }

    public boolean hasSavings() {
        return potentialMonthlySavings.signum() > 0;
    }

    public boolean usesEstimatedCost() {
        return options.stream().anyMatch(OptimizationOption::costEstimated);
    }

    /**
     * Savings as a whole percentage of the current monthly cost.
     */
    public int savingsPercentage() {
        if (currentMonthlyCost.signum() <= 0) {
            return 0;
        }
        return potentialMonthlySavings.multiply(BigDecimal.valueOf(100))
                .divide(currentMonthlyCost, 0, RoundingMode.DOWN)
                .intValue();
    }
}

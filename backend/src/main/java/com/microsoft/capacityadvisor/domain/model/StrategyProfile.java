package com.microsoft.capacityadvisor.domain.model;

/**
 * An optimization policy expressed as data.
 *
 * A non-CURRENT option qualifies when its risk does not exceed
 * {@code riskCeiling} and its projected maxima stay within the two limits.
 */
public record StrategyProfile(
        String name,
        RiskLevel riskCeiling,
        int maxProjectedCpu,
        int maxProjectedMemory,
        String description
) {

    public static final StrategyProfile AGGRESSIVE = new StrategyProfile(
            "aggressive", RiskLevel.HIGH, 90, 95,
            "Maximum cost savings (85-90% max CPU target); accepts Medium-High risk. "
                    + "Best for non-production, test/dev environments");

    public static final StrategyProfile BALANCED = new StrategyProfile(
            "balanced", RiskLevel.MEDIUM, 85, 90,
            "Balanced savings and safety (75-80% max CPU target); Low-Medium risk. "
                    + "Best for standard production workloads");

    public static final StrategyProfile CONSERVATIVE = new StrategyProfile(
            "conservative", RiskLevel.LOW, 70, 75,
            "Safe optimizations (60-70% max CPU target); Low risk only. "
                    + "Best for critical production workloads");

    public boolean accepts(OptimizationOption option) {
        return option.riskLevel().isAtMost(riskCeiling)
                && option.projected().cpuMax() <= maxProjectedCpu
                && option.projected().memMax() <= maxProjectedMemory;
    }
}

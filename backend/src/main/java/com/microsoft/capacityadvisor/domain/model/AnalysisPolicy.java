package com.microsoft.capacityadvisor.domain.model;

/**
 * Operator-chosen policy for one analysis run.
 */
public record AnalysisPolicy(StrategyProfile strategy, SavingsThresholds thresholds) {
}

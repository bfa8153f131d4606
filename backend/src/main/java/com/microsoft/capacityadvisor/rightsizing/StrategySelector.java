package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.domain.model.OptimizationOption;
import com.microsoft.capacityadvisor.domain.model.StrategyProfile;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Picks one option per resource under a strategy profile.
 *
 * A non-CURRENT option qualifies when the profile accepts it and it saves
 * strictly more than zero per month. Among qualifying options the ranking is:
 * highest savings, then lowest projected max memory, lowest projected max
 * CPU, lowest risk and finally generation order, which puts capacity-only
 * changes ahead of SKU changes. CURRENT is returned when nothing qualifies.
 */
@Component
public class StrategySelector {

    static final Comparator<OptimizationOption> PREFERENCE = Comparator
            .comparing(OptimizationOption::monthlySavings, Comparator.reverseOrder())
            .thenComparingInt(option -> option.projected().memMax())
            .thenComparingInt(option -> option.projected().cpuMax())
            .thenComparing(OptimizationOption::riskLevel)
            .thenComparing(OptimizationOption::kind);

    public OptimizationOption select(List<OptimizationOption> options, StrategyProfile strategy) {
        OptimizationOption current = options.stream()
                .filter(OptimizationOption::isCurrent)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Options must include the CURRENT configuration"));

        return options.stream()
                .filter(option -> !option.isCurrent())
                .filter(OptimizationOption::hasSavings)
                .filter(strategy::accepts)
                .min(PREFERENCE)
                .orElse(current);
    }
}

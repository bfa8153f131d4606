package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.domain.model.OptimizationOption;
import com.microsoft.capacityadvisor.domain.model.Recommendation;
import com.microsoft.capacityadvisor.domain.model.RecommendationType;
import com.microsoft.capacityadvisor.domain.model.ResourceSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles the per-resource recommendation record from a snapshot, its
 * options and the selected option.
 */
@Component
public class RecommendationBuilder {

    public Recommendation build(ResourceSnapshot snapshot,
                                List<OptimizationOption> options,
                                OptimizationOption selected,
                                String strategyName) {
        OptimizationOption current = currentOf(options);

        return base(snapshot, current, strategyName)
                .type(RecommendationType.RIGHTSIZING)
                .options(options)
                .selectedOption(selected)
                .potentialMonthlySavings(selected.monthlySavings())
                .build();
    }

    /**
     * A resource hosting no workloads: the whole current cost is recoverable
     * by deleting it, so no alternatives are offered.
     */
    public Recommendation buildEmpty(ResourceSnapshot snapshot,
                                     OptimizationOption current,
                                     String strategyName) {
        return base(snapshot, current, strategyName)
                .type(RecommendationType.EMPTY_RESOURCE)
                .options(List.of(current))
                .selectedOption(current)
                .potentialMonthlySavings(current.monthlyCost())
                .build();
    }

    private static Recommendation.RecommendationBuilder base(ResourceSnapshot snapshot,
                                                             OptimizationOption current,
                                                             String strategyName) {
        return Recommendation.builder()
                .resourceId(snapshot.id())
                .resourceName(snapshot.displayName())
                .resourceGroup(snapshot.resourceGroup())
                .currentConfiguration(current.configuration())
                .currentUtilization(current.projected())
                .workloadCount(snapshot.workloadCount())
                .runningWorkloadCount(snapshot.runningWorkloadCount())
                .strategy(strategyName)
                .currentMonthlyCost(current.monthlyCost());
    }

    private static OptimizationOption currentOf(List<OptimizationOption> options) {
        return options.stream()
                .filter(OptimizationOption::isCurrent)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Options must include the CURRENT configuration"));
    }
}

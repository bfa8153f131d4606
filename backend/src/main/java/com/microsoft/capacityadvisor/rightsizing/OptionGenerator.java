package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.domain.model.OptimizationOption;
import com.microsoft.capacityadvisor.domain.model.OptionKind;
import com.microsoft.capacityadvisor.domain.model.ResourceConfiguration;
import com.microsoft.capacityadvisor.domain.model.UtilizationSample;
import com.microsoft.capacityadvisor.pricing.CostEstimate;
import com.microsoft.capacityadvisor.pricing.CostModel;
import com.microsoft.capacityadvisor.pricing.PricingCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates the candidate configurations for one resource.
 *
 * CANDIDATES (in this order):
 * - CURRENT: always
 * - SCALE_DOWN_1: capacity - 1, when capacity > 1
 * - SCALE_DOWN_50: ceil(capacity / 2), when capacity > 2
 * - SKU_DOWNGRADE: next smaller SKU, same capacity, when the catalog has one
 * - COMBINED: next smaller SKU at ceil(capacity / 2), when a smaller SKU
 *   exists and capacity > 1
 *
 * Each candidate carries its projected utilization, risk, confidence, cost
 * and savings against CURRENT. Savings may be zero or negative; filtering is
 * left to strategy selection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OptionGenerator {

    private final UtilizationProjector projector;
    private final RiskClassifier riskClassifier;
    private final CostModel costModel;
    private final PricingCatalog pricingCatalog;

    public List<OptimizationOption> generate(ResourceConfiguration configuration, UtilizationSample utilization) {
        OptimizationOption current = baseline(configuration, utilization);
        int capacity = configuration.capacity();

        List<OptimizationOption> options = new ArrayList<>();
        options.add(current);

        if (capacity > 1) {
            options.add(candidate(OptionKind.SCALE_DOWN_1, configuration.withCapacity(capacity - 1),
                    UtilizationProjector.SAME_SKU_FACTOR, configuration, utilization, current));
        }

        if (capacity > 2) {
            options.add(candidate(OptionKind.SCALE_DOWN_50, configuration.withCapacity(halvedCapacity(capacity)),
                    UtilizationProjector.SAME_SKU_FACTOR, configuration, utilization, current));
        }

        pricingCatalog.downgradeOf(configuration.tier(), configuration.skuName()).ifPresent(target -> {
            ResourceConfiguration downgraded = configuration.withSku(target.tier(), target.skuName());
            options.add(candidate(OptionKind.SKU_DOWNGRADE, downgraded,
                    UtilizationProjector.SKU_DOWNGRADE_FACTOR, configuration, utilization, current));

            if (capacity > 1) {
                options.add(candidate(OptionKind.COMBINED, downgraded.withCapacity(halvedCapacity(capacity)),
                        UtilizationProjector.SKU_DOWNGRADE_FACTOR, configuration, utilization, current));
            }
        });

        log.debug("Generated {} option(s) for {} ({} x{})",
                options.size(), configuration.resourceId(), configuration.skuLabel(), capacity);

        return List.copyOf(options);
    }

    /**
     * The CURRENT option alone: the configuration priced as-is, no risk, no savings.
     */
    public OptimizationOption baseline(ResourceConfiguration configuration, UtilizationSample utilization) {
        if (configuration.capacity() < 1) {
            throw new InvalidCapacityException(configuration.resourceId(), configuration.capacity());
        }

        CostEstimate cost = cost(configuration);
        RiskClassifier.Assessment assessment = riskClassifier.classify(OptionKind.CURRENT, utilization, utilization);

        return OptimizationOption.builder()
                .kind(OptionKind.CURRENT)
                .configuration(configuration)
                .description(OptionKind.CURRENT.getDescription())
                .riskLevel(assessment.riskLevel())
                .confidence(assessment.confidence())
                .projected(utilization)
                .monthlyCost(cost.monthlyCost())
                .monthlySavings(BigDecimal.ZERO)
                .costEstimated(cost.estimated())
                .build();
    }

    private OptimizationOption candidate(OptionKind kind,
                                         ResourceConfiguration target,
                                         int skuFactor,
                                         ResourceConfiguration source,
                                         UtilizationSample utilization,
                                         OptimizationOption current) {
        UtilizationSample projected = projector.project(utilization, source.capacity(), target.capacity(), skuFactor);
        RiskClassifier.Assessment assessment = riskClassifier.classify(kind, utilization, projected);
        CostEstimate cost = cost(target);

        return OptimizationOption.builder()
                .kind(kind)
                .configuration(target)
                .description(describe(kind, source, target))
                .riskLevel(assessment.riskLevel())
                .confidence(assessment.confidence())
                .projected(projected)
                .monthlyCost(cost.monthlyCost())
                .monthlySavings(current.monthlyCost().subtract(cost.monthlyCost()))
                .costEstimated(current.costEstimated() || cost.estimated())
                .build();
    }

    private CostEstimate cost(ResourceConfiguration configuration) {
        return costModel.cost(configuration.tier(), configuration.skuName(), configuration.capacity());
    }

    private static String describe(OptionKind kind, ResourceConfiguration from, ResourceConfiguration to) {
        StringBuilder detail = new StringBuilder(kind.getDescription()).append(" (");
        if (!Objects.equals(from.skuName(), to.skuName())) {
            detail.append(from.skuName()).append(" -> ").append(to.skuName());
            if (from.capacity() != to.capacity()) {
                detail.append(", ");
            }
        }
        if (from.capacity() != to.capacity()) {
            detail.append(from.capacity()).append(" -> ").append(to.capacity()).append(" instances");
        }
        return detail.append(')').toString();
    }

    static int halvedCapacity(int capacity) {
        return (capacity + 1) / 2;
    }
}

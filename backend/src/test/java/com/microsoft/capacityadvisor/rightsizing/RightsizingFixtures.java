package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.config.RightsizingProperties;
import com.microsoft.capacityadvisor.domain.model.ResourceSnapshot;
import com.microsoft.capacityadvisor.findings.ImpactAggregator;
import com.microsoft.capacityadvisor.pricing.CostModel;
import com.microsoft.capacityadvisor.pricing.PricingCatalog;
import com.microsoft.capacityadvisor.pricing.PricingFixtures;

import java.util.concurrent.Executor;

/**
 * Builds the rightsizing pipeline from real components for tests.
 */
public final class RightsizingFixtures {

    private RightsizingFixtures() {
    }

    public static OptionGenerator optionGenerator() {
        PricingCatalog catalog = PricingFixtures.bundledCatalog();
        return new OptionGenerator(new UtilizationProjector(), new RiskClassifier(), new CostModel(catalog), catalog);
    }

    public static RightsizingEngine engine(RightsizingProperties properties, Executor executor) {
        return engine(optionGenerator(), properties, executor);
    }

    public static RightsizingEngine engine(OptionGenerator optionGenerator,
                                           RightsizingProperties properties,
                                           Executor executor) {
        return new RightsizingEngine(
                optionGenerator,
                new StrategySelector(),
                new RecommendationBuilder(),
                new ImpactAggregator(),
                new StrategyCatalog(properties),
                properties,
                executor
        );
    }

    /**
     * Engine running every resource on the calling thread.
     */
    public static RightsizingEngine directEngine() {
        return engine(new RightsizingProperties(), Runnable::run);
    }

    public static ResourceSnapshot snapshot(String id, String tier, String sku, int capacity,
                                            Integer cpuAvg, Integer cpuMax, Integer memAvg, Integer memMax) {
        return new ResourceSnapshot(id, id + "-plan", "rg-" + id, tier, sku, capacity, "eastus",
                3, 3, new ResourceSnapshot.MetricWindow(cpuAvg, cpuMax, memAvg, memMax));
    }

    public static ResourceSnapshot emptySnapshot(String id, String tier, String sku, int capacity) {
        return new ResourceSnapshot(id, id + "-plan", "rg-" + id, tier, sku, capacity, "eastus",
                0, 0, new ResourceSnapshot.MetricWindow(0, 0, 0, 0));
    }
}

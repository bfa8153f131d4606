package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.config.RightsizingProperties;
import com.microsoft.capacityadvisor.domain.model.AnalysisPolicy;
import com.microsoft.capacityadvisor.domain.model.AnalysisResult;
import com.microsoft.capacityadvisor.domain.model.AnalysisResult.SkippedResource;
import com.microsoft.capacityadvisor.domain.model.Finding;
import com.microsoft.capacityadvisor.domain.model.OptimizationOption;
import com.microsoft.capacityadvisor.domain.model.Recommendation;
import com.microsoft.capacityadvisor.domain.model.ResourceConfiguration;
import com.microsoft.capacityadvisor.domain.model.ResourceSnapshot;
import com.microsoft.capacityadvisor.domain.model.SavingsThresholds;
import com.microsoft.capacityadvisor.domain.model.StrategyProfile;
import com.microsoft.capacityadvisor.domain.model.UtilizationSample;
import com.microsoft.capacityadvisor.findings.ImpactAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the rightsizing pipeline over a batch of resource snapshots.
 *
 * PIPELINE (per resource, on the bounded worker pool):
 * 1. Resource without workloads: price CURRENT and recommend deletion
 * 2. Otherwise generate options, project utilization, rate risk and cost
 * 3. Select one option under the strategy profile
 * 4. Assemble the recommendation
 *
 * Once every resource has completed, failed or timed out, the recommendations
 * are grouped into findings in a single pass.
 *
 * FAILURE HANDLING:
 * A resource that fails or exceeds the per-resource timeout is reported as
 * skipped. It never aborts the rest of the batch.
 */
@Service
@Slf4j
public class RightsizingEngine {

    private final OptionGenerator optionGenerator;
    private final StrategySelector strategySelector;
    private final RecommendationBuilder recommendationBuilder;
    private final ImpactAggregator impactAggregator;
    private final StrategyCatalog strategyCatalog;
    private final RightsizingProperties properties;
    private final Executor executor;

    public RightsizingEngine(OptionGenerator optionGenerator,
                             StrategySelector strategySelector,
                             RecommendationBuilder recommendationBuilder,
                             ImpactAggregator impactAggregator,
                             StrategyCatalog strategyCatalog,
                             RightsizingProperties properties,
                             @Qualifier("rightsizingExecutor") Executor executor) {
        this.optionGenerator = optionGenerator;
        this.strategySelector = strategySelector;
        this.recommendationBuilder = recommendationBuilder;
        this.impactAggregator = impactAggregator;
        this.strategyCatalog = strategyCatalog;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Analyse with the named strategy and thresholds. Null arguments fall back
     * to the configured defaults.
     */
    public AnalysisResult analyze(List<ResourceSnapshot> snapshots, String strategyName, SavingsThresholds thresholds) {
        return analyze(snapshots, policyFor(strategyName, thresholds));
    }

    public AnalysisResult analyze(List<ResourceSnapshot> snapshots, AnalysisPolicy policy) {
        StrategyProfile strategy = policy.strategy();
        Duration timeout = properties.getExecutor().getResourceTimeout();

        log.info("Analyzing {} resource(s) with '{}' strategy", snapshots.size(), strategy.name());

        List<CompletableFuture<Recommendation>> futures = snapshots.stream()
                .map(snapshot -> submit(snapshot, strategy, timeout))
                .toList();

        List<Recommendation> recommendations = new ArrayList<>();
        List<SkippedResource> skipped = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            ResourceSnapshot snapshot = snapshots.get(i);
            String resourceId = snapshot != null ? snapshot.id() : null;
            try {
                recommendations.add(futures.get(i).join());
            } catch (CompletionException e) {
                String reason = describeFailure(e.getCause() != null ? e.getCause() : e, timeout);
                log.error("Skipping resource {} (position {}): {}", resourceId, i, reason);
                skipped.add(new SkippedResource(resourceId, reason));
            }
        }

        List<Finding> findings = impactAggregator.aggregate(recommendations, policy.thresholds());

        log.info("Analysis complete: {} recommendation(s), {} finding(s), {} skipped",
                recommendations.size(), findings.size(), skipped.size());

        return new AnalysisResult(policy, recommendations, findings, skipped);
    }

    /**
     * Analyse a single resource on the calling thread.
     */
    public Recommendation analyzeResource(ResourceSnapshot snapshot, StrategyProfile strategy) {
        ResourceConfiguration configuration = snapshot.configuration();
        UtilizationSample utilization = snapshot.utilizationSample();

        if (utilization.hasMissingMetrics()) {
            log.warn("Resource {} is missing metrics {}; treated as 0 and confidence lowered",
                    snapshot.id(), utilization.missingMetrics());
        }

        if (snapshot.hasNoWorkloads()) {
            log.debug("Resource {} hosts no workloads", snapshot.id());
            OptimizationOption current = optionGenerator.baseline(configuration, utilization);
            return recommendationBuilder.buildEmpty(snapshot, current, strategy.name());
        }

        List<OptimizationOption> options = optionGenerator.generate(configuration, utilization);
        OptimizationOption selected = strategySelector.select(options, strategy);

        log.debug("Resource {}: selected {} ({} option(s))", snapshot.id(), selected.kind(), options.size());

        return recommendationBuilder.build(snapshot, options, selected, strategy.name());
    }

    public AnalysisPolicy policyFor(String strategyName, SavingsThresholds thresholds) {
        return new AnalysisPolicy(
                strategyCatalog.resolve(strategyName),
                thresholds != null ? thresholds : properties.getThresholds().toSavingsThresholds()
        );
    }

    private CompletableFuture<Recommendation> submit(ResourceSnapshot snapshot, StrategyProfile strategy, Duration timeout) {
        if (snapshot == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("missing resource snapshot"));
        }
        return CompletableFuture
                .supplyAsync(() -> analyzeResource(snapshot, strategy), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static String describeFailure(Throwable cause, Duration timeout) {
        if (cause instanceof TimeoutException) {
            return "analysis timed out after " + timeout.toSeconds() + "s";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

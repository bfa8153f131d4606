package com.microsoft.capacityadvisor.domain.model;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.IntUnaryOperator;

/**
 * Average and maximum CPU and memory utilization over the trailing window.
 *
 * All values are whole percentages clamped to [0, 100]. Metrics the source
 * could not provide are recorded as 0 and listed in {@code missingMetrics},
 * so downstream scoring can lower its confidence instead of hiding the gap.
 */
public record UtilizationSample(
        int cpuAvg,
        int cpuMax,
        int memAvg,
        int memMax,
        Set<UtilizationMetric> missingMetrics
) {

    public UtilizationSample {
        cpuAvg = clamp(cpuAvg);
        cpuMax = clamp(cpuMax);
        memAvg = clamp(memAvg);
        memMax = clamp(memMax);
        missingMetrics = missingMetrics == null || missingMetrics.isEmpty()
                ? Set.of()
                : Set.copyOf(missingMetrics);
    }

    public static UtilizationSample of(int cpuAvg, int cpuMax, int memAvg, int memMax) {
        return new UtilizationSample(cpuAvg, cpuMax, memAvg, memMax, Set.of());
    }

    /**
     * Build a sample from raw collaborator values where any metric may be absent.
     */
    public static UtilizationSample fromMetrics(Integer cpuAvg, Integer cpuMax, Integer memAvg, Integer memMax) {
        Set<UtilizationMetric> missing = EnumSet.noneOf(UtilizationMetric.class);
        if (cpuAvg == null) missing.add(UtilizationMetric.CPU_AVG);
        if (cpuMax == null) missing.add(UtilizationMetric.CPU_MAX);
        if (memAvg == null) missing.add(UtilizationMetric.MEMORY_AVG);
        if (memMax == null) missing.add(UtilizationMetric.MEMORY_MAX);

        return new UtilizationSample(
                cpuAvg != null ? cpuAvg : 0,
                cpuMax != null ? cpuMax : 0,
                memAvg != null ? memAvg : 0,
                memMax != null ? memMax : 0,
                missing
        );
    }

    public int get(UtilizationMetric metric) {
        return switch (metric) {
            case CPU_AVG -> cpuAvg;
            case CPU_MAX -> cpuMax;
            case MEMORY_AVG -> memAvg;
            case MEMORY_MAX -> memMax;
        };
    }

    /**
     * Apply the same transformation to every metric, keeping the missing-metric set.
     */
    public UtilizationSample map(IntUnaryOperator operator) {
        return new UtilizationSample(
                operator.applyAsInt(cpuAvg),
                operator.applyAsInt(cpuMax),
                operator.applyAsInt(memAvg),
                operator.applyAsInt(memMax),
                missingMetrics
        );
    }

    public boolean hasMissingMetrics() {
        return !missingMetrics.isEmpty();
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}

package com.microsoft.capacityadvisor.domain.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * One resource as supplied by the inventory collaborator: configuration,
 * utilization window and workload counts.
 *
 * Metrics are nullable. A null workload count means the collaborator did not
 * report workloads and the resource is analysed as in use.
 */
public record ResourceSnapshot(
        @NotBlank String id,
        String name,
        String resourceGroup,
        @NotBlank String tier,
        @NotBlank String sku,
        @Min(1) int capacity,
        String location,
        @Min(0) Integer workloadCount,
        @Min(0) Integer runningWorkloadCount,
        @Valid MetricWindow utilization
) {

    public ResourceConfiguration configuration() {
        return new ResourceConfiguration(id, tier, sku, capacity, location);
    }

    public UtilizationSample utilizationSample() {
        if (utilization == null) {
            return UtilizationSample.fromMetrics(null, null, null, null);
        }
        return UtilizationSample.fromMetrics(
                utilization.cpuAvg(),
                utilization.cpuMax(),
                utilization.memAvg(),
                utilization.memMax()
        );
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public boolean hasNoWorkloads() {
        return workloadCount != null && workloadCount == 0;
    }

    /**
     * Raw metric values over the trailing window, any of which may be absent.
     */
    public record MetricWindow(
            Integer cpuAvg,
            Integer cpuMax,
            Integer memAvg,
            Integer memMax
    ) {}
}

package com.microsoft.capacityadvisor.domain.model;

/**
 * The four utilization metrics tracked per resource over the trailing window.
 */
public enum UtilizationMetric {
    CPU_AVG("CPU avg"),
    CPU_MAX("CPU max"),
    MEMORY_AVG("Memory avg"),
    MEMORY_MAX("Memory max");

    private final String displayName;

    UtilizationMetric(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

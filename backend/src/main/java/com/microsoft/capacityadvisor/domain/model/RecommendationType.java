package com.microsoft.capacityadvisor.domain.model;

/**
 * How a recommendation was produced.
 */
public enum RecommendationType {
    /**
     * Options were generated and one was selected by the strategy.
     */
    RIGHTSIZING("Rightsizing"),

    /**
     * The resource hosts no workloads. Option generation is skipped and the
     * whole current cost counts as potential savings.
     */
    EMPTY_RESOURCE("Empty resource");

    private final String displayName;

    RecommendationType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

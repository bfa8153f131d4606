package com.microsoft.capacityadvisor.domain.model;

/**
 * Candidate configuration kinds produced for a resource.
 *
 * Declaration order is the generation order. It carries no preference on its
 * own and is only used as the last tie-breaker when ranking candidates.
 */
public enum OptionKind {
    /**
     * Baseline: keep the configuration as it is.
     * Always generated, always first.
     */
    CURRENT("Keep current configuration - No changes", false),

    /**
     * Remove one instance. Requires capacity > 1.
     */
    SCALE_DOWN_1("Reduce capacity by 1 instance", false),

    /**
     * Halve the instance count, rounding up. Requires capacity > 2
     * so it never duplicates SCALE_DOWN_1.
     */
    SCALE_DOWN_50("Reduce capacity by 50%", false),

    /**
     * Move to the next smaller SKU in the same tier, keeping capacity.
     * Halves the resources of each instance.
     */
    SKU_DOWNGRADE("Downgrade SKU tier (half resources per instance)", true),

    /**
     * Next smaller SKU combined with a halved instance count.
     */
    COMBINED("Downgrade SKU + reduce capacity", true);

    private final String description;
    private final boolean skuDowngrade;

    OptionKind(String description, boolean skuDowngrade) {
        this.description = description;
        this.skuDowngrade = skuDowngrade;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether this kind moves the resource to a smaller SKU.
     */
    public boolean isSkuDowngrade() {
        return skuDowngrade;
    }
}

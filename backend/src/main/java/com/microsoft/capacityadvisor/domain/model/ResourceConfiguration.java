package com.microsoft.capacityadvisor.domain.model;

/**
 * Immutable snapshot of a resource's provisioned configuration.
 *
 * Capacity is not validated here: raw collaborator data is carried as-is and
 * rejected where options are generated.
 */
public record ResourceConfiguration(
        String resourceId,
        String tier,
        String skuName,
        int capacity,
        String location
) {

    public ResourceConfiguration withSku(String newTier, String newSkuName) {
        return new ResourceConfiguration(resourceId, newTier, newSkuName, capacity, location);
    }

    public ResourceConfiguration withCapacity(int newCapacity) {
        return new ResourceConfiguration(resourceId, tier, skuName, newCapacity, location);
    }

    /**
     * "Premium P3" style label used in reports.
     */
    public String skuLabel() {
        return tier + " " + skuName;
    }
}

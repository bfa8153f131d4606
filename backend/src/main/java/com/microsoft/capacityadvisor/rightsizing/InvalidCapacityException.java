package com.microsoft.capacityadvisor.rightsizing;

/**
 * A configuration reached option generation with fewer than one instance.
 * Signals bad source data, not a runtime condition.
 */
public class InvalidCapacityException extends IllegalArgumentException {

    private final String resourceId;
    private final int capacity;

    public InvalidCapacityException(String resourceId, int capacity) {
        super("Resource " + resourceId + " has invalid capacity " + capacity + " (must be at least 1)");
        this.resourceId = resourceId;
        this.capacity = capacity;
    }

    public String getResourceId() {
        return resourceId;
    }

    public int getCapacity() {
        return capacity;
    }
}

package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.domain.model.UtilizationSample;
import org.springframework.stereotype.Component;

/**
 * Projects utilization after a capacity and/or SKU change.
 *
 * MODEL:
 * Load is assumed to spread evenly over the total provisioned capacity, so
 * utilization scales inversely with it:
 *
 *   projected = clamp(round(current * currentCapacity * skuFactor / newCapacity), 0, 100)
 *
 * applied to each metric independently. skuFactor is 2 for one SKU step down
 * (half the resources per instance) and 1 otherwise.
 *
 * This is a linear approximation, not a measurement. Reports built from
 * projected values say so.
 */
@Component
public class UtilizationProjector {

    public static final int SAME_SKU_FACTOR = 1;
    public static final int SKU_DOWNGRADE_FACTOR = 2;

    public static final String APPROXIMATION_NOTE =
            "Projected utilization is a linear approximation (load scales inversely with "
                    + "provisioned capacity), not a measured value";

    public UtilizationSample project(UtilizationSample current, int currentCapacity, int newCapacity, int skuFactor) {
        if (currentCapacity < 1 || newCapacity < 1) {
            throw new IllegalArgumentException(
                    "Capacities must be at least 1, got " + currentCapacity + " -> " + newCapacity);
        }
        if (skuFactor < 1) {
            throw new IllegalArgumentException("SKU factor must be at least 1, got " + skuFactor);
        }

        long numeratorScale = (long) currentCapacity * skuFactor;
        return current.map(value -> (int) Math.round((double) (value * numeratorScale) / newCapacity));
    }
}

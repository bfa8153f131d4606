package com.microsoft.capacityadvisor.domain.model;

/**
 * Ordinal risk that a candidate change exhausts the resource.
 *
 * Ordering matters: NONE &lt; LOW &lt; MEDIUM &lt; HIGH. Strategy ceilings
 * compare against the declaration order.
 */
public enum RiskLevel {
    /**
     * No change is made. Only used for the CURRENT option.
     */
    NONE("No Change", "Keep the existing configuration"),

    /**
     * Projected utilization stays well within safe thresholds.
     */
    LOW("Low Risk", "Safe to implement, minimal performance impact"),

    /**
     * Projected utilization approaches recommended thresholds.
     */
    MEDIUM("Medium Risk", "Monitor closely after implementation, implement during low-traffic"),

    /**
     * Projected utilization is near capacity limits.
     */
    HIGH("High Risk", "Requires careful evaluation, consider gradual rollout");

    private final String displayLabel;
    private final String guidance;

    RiskLevel(String displayLabel, String guidance) {
        this.displayLabel = displayLabel;
        this.guidance = guidance;
    }

    public String getDisplayLabel() {
        return displayLabel;
    }

    public String getGuidance() {
        return guidance;
    }

    public boolean isAtMost(RiskLevel ceiling) {
        return compareTo(ceiling) <= 0;
    }
}

package com.microsoft.capacityadvisor.domain.model;

/**
 * Financial impact bands for grouping recommendations into findings.
 *
 * The severity code is consumed by the reporting surface: lower numbers are
 * more urgent.
 */
public enum SavingsBand {
    HIGH(2, "These are the largest opportunities. Prioritize LOW-risk recommendations first. "
            + "For empty resources, delete them if no longer needed. For underutilized resources, "
            + "consider rightsizing to smaller SKUs or consolidating workloads onto fewer resources."),
    MEDIUM(3, "Prioritize LOW-risk recommendations first. Consider consolidating workloads or "
            + "rightsizing these resources to optimize costs."),
    LOW(4, "These are lower-priority optimizations based on savings amount, but LOW-risk "
            + "recommendations can be implemented safely. Address LOW-risk items first, then "
            + "tackle MEDIUM-risk during regular maintenance windows.");

    private final int severity;
    private final String nextStep;

    SavingsBand(int severity, String nextStep) {
        this.severity = severity;
        this.nextStep = nextStep;
    }

    public int getSeverity() {
        return severity;
    }

    public String getNextStep() {
        return nextStep;
    }
}

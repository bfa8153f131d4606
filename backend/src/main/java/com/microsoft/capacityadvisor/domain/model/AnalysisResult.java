package com.microsoft.capacityadvisor.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of one batch pass: recommendations in input order, findings in
 * HIGH, MEDIUM, LOW order and the resources that could not be analysed.
 */
public record AnalysisResult(
        AnalysisPolicy policy,
        List<Recommendation> recommendations,
        List<Finding> findings,
        List<SkippedResource> skipped
) {

    public AnalysisResult {
        recommendations = List.copyOf(recommendations);
        findings = List.copyOf(findings);
        skipped = List.copyOf(skipped);
    }

    public List<Recommendation> opportunities() {
        return recommendations.stream()
                .filter(Recommendation::hasSavings)
                .toList();
    }

    public BigDecimal totalMonthlySavings() {
        return findings.stream()
                .map(Finding::totalMonthlySavings)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * A resource dropped from the run and the reason it was dropped.
     */
    public record SkippedResource(String resourceId, String reason) {
    }
}

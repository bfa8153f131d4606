package com.microsoft.capacityadvisor.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Severity-banded summary over the recommendations whose potential savings
 * fall into one band.
 *
 * Serialized with member ids only; the full recommendations are written
 * separately.
 */
public record Finding(
        SavingsBand band,
        int severity,
        String title,
        String summary,
        String nextStep,
        BigDecimal totalMonthlySavings,
        BigDecimal totalAnnualSavings,
        @JsonIgnore List<Recommendation> members
) {

    public Finding {
        members = List.copyOf(members);
    }

    @JsonProperty("memberResourceIds")
    public List<String> memberResourceIds() {
        return members.stream()
                .map(Recommendation::resourceId)
                .toList();
    }
}

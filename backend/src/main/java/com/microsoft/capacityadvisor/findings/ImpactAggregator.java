package com.microsoft.capacityadvisor.findings;

import com.microsoft.capacityadvisor.domain.model.Finding;
import com.microsoft.capacityadvisor.domain.model.Recommendation;
import com.microsoft.capacityadvisor.domain.model.RecommendationType;
import com.microsoft.capacityadvisor.domain.model.SavingsBand;
import com.microsoft.capacityadvisor.domain.model.SavingsThresholds;
import com.microsoft.capacityadvisor.domain.model.UtilizationSample;
import com.microsoft.capacityadvisor.report.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups recommendations into at most three findings by monthly savings.
 *
 * BANDING:
 * - HIGH: savings >= thresholds.high (severity 2)
 * - MEDIUM: thresholds.medium <= savings < thresholds.high (severity 3)
 * - LOW: 0 < savings < thresholds.medium (severity 4)
 *
 * Recommendations without positive savings belong to no finding. Bands with
 * no members produce no finding. Findings come back in HIGH, MEDIUM, LOW
 * order with members in input order.
 */
@Component
@Slf4j
public class ImpactAggregator {

    static final int MAX_LISTED_MEMBERS = 20;

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    public List<Finding> aggregate(List<Recommendation> recommendations, SavingsThresholds thresholds) {
        Map<SavingsBand, List<Recommendation>> byBand = new EnumMap<>(SavingsBand.class);

        for (Recommendation recommendation : recommendations) {
            if (!recommendation.hasSavings()) {
                continue;
            }
            SavingsBand band = thresholds.bandFor(recommendation.potentialMonthlySavings());
            byBand.computeIfAbsent(band, b -> new ArrayList<>()).add(recommendation);
        }

        List<Finding> findings = new ArrayList<>();
        for (SavingsBand band : SavingsBand.values()) {
            List<Recommendation> members = byBand.get(band);
            if (members != null) {
                findings.add(toFinding(band, members, thresholds));
            }
        }

        log.info("Grouped {} opportunity(ies) into {} finding(s)",
                byBand.values().stream().mapToInt(List::size).sum(), findings.size());

        return List.copyOf(findings);
    }

    private Finding toFinding(SavingsBand band, List<Recommendation> members, SavingsThresholds thresholds) {
        BigDecimal monthly = members.stream()
                .map(Recommendation::potentialMonthlySavings)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal annual = monthly.multiply(MONTHS_PER_YEAR);

        String title = band + " savings: " + members.size() + " resource(s) could save "
                + Money.format(monthly) + "/month";

        return new Finding(
                band,
                band.getSeverity(),
                title,
                summarize(band, members, thresholds, monthly, annual),
                band.getNextStep(),
                monthly,
                annual,
                members
        );
    }

    private String summarize(SavingsBand band,
                             List<Recommendation> members,
                             SavingsThresholds thresholds,
                             BigDecimal monthly,
                             BigDecimal annual) {
        StringBuilder summary = new StringBuilder()
                .append("Found ").append(members.size()).append(" resource(s) with ").append(band)
                .append(" potential savings (").append(rangeOf(band, thresholds)).append(" each).\n\n")
                .append("Total Potential Savings: ").append(Money.format(monthly)).append("/month (")
                .append(Money.format(annual)).append("/year)\n\n");

        if (band == SavingsBand.LOW) {
            summary.append("TIP: Focus on LOW-risk recommendations first; they are safer to implement and still add up.\n\n");
        } else {
            summary.append("NOTE: Review implementation risk for each recommendation before proceeding.\n\n");
        }

        summary.append("Affected resources (with risk assessment):\n");
        members.stream()
                .limit(MAX_LISTED_MEMBERS)
                .forEach(member -> summary.append(describeMember(member)));

        if (members.size() > MAX_LISTED_MEMBERS) {
            summary.append("... and ").append(members.size() - MAX_LISTED_MEMBERS).append(" more\n");
        }
        return summary.toString();
    }

    private static String describeMember(Recommendation member) {
        UtilizationSample utilization = member.currentUtilization();
        String usage = member.type() == RecommendationType.EMPTY_RESOURCE
                ? "EMPTY (no workloads)"
                : "CPU: " + utilization.cpuAvg() + "% avg, " + utilization.cpuMax() + "% max";

        return "- " + member.resourceName() + " (" + member.resourceGroup() + "): "
                + Money.format(member.potentialMonthlySavings()) + "/month savings - Risk: "
                + member.selectedOption().riskLevel() + "\n"
                + "  Current: " + member.currentConfiguration().skuName()
                + " x" + member.currentConfiguration().capacity() + " | " + usage + "\n";
    }

    private static String rangeOf(SavingsBand band, SavingsThresholds thresholds) {
        return switch (band) {
            case HIGH -> ">= " + Money.format(thresholds.high()) + "/month";
            case MEDIUM -> Money.format(thresholds.medium()) + "-" + Money.format(thresholds.high()) + "/month";
            case LOW -> "< " + Money.format(thresholds.medium()) + "/month";
        };
    }
}

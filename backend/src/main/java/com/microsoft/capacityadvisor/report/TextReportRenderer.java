package com.microsoft.capacityadvisor.report;

import com.microsoft.capacityadvisor.domain.model.AnalysisResult;
import com.microsoft.capacityadvisor.domain.model.Finding;
import com.microsoft.capacityadvisor.domain.model.OptimizationOption;
import com.microsoft.capacityadvisor.domain.model.Recommendation;
import com.microsoft.capacityadvisor.domain.model.RecommendationType;
import com.microsoft.capacityadvisor.domain.model.ResourceConfiguration;
import com.microsoft.capacityadvisor.domain.model.RiskLevel;
import com.microsoft.capacityadvisor.domain.model.SavingsThresholds;
import com.microsoft.capacityadvisor.domain.model.StrategyProfile;
import com.microsoft.capacityadvisor.domain.model.UtilizationSample;
import com.microsoft.capacityadvisor.rightsizing.UtilizationProjector;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Plain-text summary of an analysis run for operators.
 *
 * SECTIONS:
 * 1. Analysis configuration (strategy, thresholds, projection disclaimer)
 * 2. Cost savings summary
 * 3. Top savings opportunities
 * 4. Detailed rightsizing recommendations with every option
 * 5. Empty resources
 * 6. Findings overview
 * 7. Notes
 */
@Component
public class TextReportRenderer {

    static final int TOP_OPPORTUNITIES = 5;
    static final int MEMORY_PRESSURE = 90;
    static final int DOWNGRADE_MEMORY_PRESSURE = 80;

    private static final String RULE = "=".repeat(72);
    private static final String SECTION_RULE = "-".repeat(72);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int DESCRIPTION_WIDTH = 64;

    private final Clock clock;

    public TextReportRenderer() {
        this(Clock.systemDefaultZone());
    }

    TextReportRenderer(Clock clock) {
        this.clock = clock;
    }

    public String render(AnalysisResult result) {
        StringBuilder out = new StringBuilder();

        out.append(RULE).append('\n')
                .append("  APP SERVICE PLAN RIGHTSIZING REPORT\n")
                .append(RULE).append("\n\n");

        renderConfiguration(out, result);
        renderCostSummary(out, result);
        renderTopOpportunities(out, result);
        renderDetails(out, result);
        renderEmptyResources(out, result);
        renderFindings(out, result);
        renderNotes(out, result);

        return out.toString();
    }

    private void renderConfiguration(StringBuilder out, AnalysisResult result) {
        StrategyProfile strategy = result.policy().strategy();
        SavingsThresholds thresholds = result.policy().thresholds();

        section(out, "ANALYSIS CONFIGURATION");
        out.append("- Optimization Strategy: ").append(strategy.name()).append('\n')
                .append("  ").append(strategy.description()).append('\n')
                .append("  Accepts risk up to ").append(strategy.riskCeiling())
                .append(", projected max CPU <= ").append(strategy.maxProjectedCpu())
                .append("%, projected max memory <= ").append(strategy.maxProjectedMemory()).append("%\n")
                .append("- Savings bands: HIGH >= ").append(Money.format(thresholds.high()))
                .append("/month, MEDIUM >= ").append(Money.format(thresholds.medium())).append("/month\n")
                .append("- Date: ").append(LocalDateTime.now(clock).format(TIMESTAMP)).append('\n')
                .append("- ").append(UtilizationProjector.APPROXIMATION_NOTE).append("\n\n");
    }

    private void renderCostSummary(StringBuilder out, AnalysisResult result) {
        List<Recommendation> opportunities = result.opportunities();
        BigDecimal currentSpend = sum(opportunities, Recommendation::currentMonthlyCost);
        BigDecimal monthlySavings = sum(opportunities, Recommendation::potentialMonthlySavings);
        BigDecimal annualSavings = sum(opportunities, Recommendation::potentialAnnualSavings);

        section(out, "COST SAVINGS SUMMARY");
        out.append("Current Monthly Spend:      ").append(Money.format(currentSpend))
                .append(" (for resources with opportunities)\n")
                .append("Potential Monthly Savings:  ").append(Money.format(monthlySavings))
                .append(" (").append(percentage(monthlySavings, currentSpend)).append("% reduction)\n")
                .append("Potential Annual Savings:   ").append(Money.format(annualSavings)).append('\n')
                .append("Recommended Monthly Spend:  ").append(Money.format(currentSpend.subtract(monthlySavings))).append('\n')
                .append("Optimization Opportunities: ").append(opportunities.size()).append('\n')
                .append("Resources Analysed:         ").append(result.recommendations().size());
        if (!result.skipped().isEmpty()) {
            out.append(" (").append(result.skipped().size()).append(" skipped)");
        }
        out.append("\n\n");
    }

    private void renderTopOpportunities(StringBuilder out, AnalysisResult result) {
        section(out, "TOP SAVINGS OPPORTUNITIES");
        List<Recommendation> top = result.opportunities().stream()
                .sorted(Comparator.comparing(Recommendation::potentialMonthlySavings).reversed())
                .limit(TOP_OPPORTUNITIES)
                .toList();

        if (top.isEmpty()) {
            out.append("No savings opportunities under the selected strategy.\n\n");
            return;
        }

        for (Recommendation rec : top) {
            out.append("  - ").append(rec.resourceName()).append(" - ")
                    .append(Money.format(rec.potentialMonthlySavings())).append("/month (")
                    .append(rec.savingsPercentage()).append("% savings)\n")
                    .append("    Current: ").append(sizeOf(rec.currentConfiguration()))
                    .append(" | ").append(usageOf(rec)).append('\n')
                    .append("    Action: ").append(rec.selectedOption().description()).append('\n');
        }
        out.append('\n');
    }

    private void renderDetails(StringBuilder out, AnalysisResult result) {
        section(out, "DETAILED RIGHTSIZING RECOMMENDATIONS");
        List<Recommendation> rightsizing = result.recommendations().stream()
                .filter(rec -> rec.type() == RecommendationType.RIGHTSIZING)
                .toList();

        if (rightsizing.isEmpty()) {
            out.append("No resources with workloads were analysed.\n\n");
            return;
        }

        for (Recommendation rec : rightsizing) {
            UtilizationSample usage = rec.currentUtilization();
            OptimizationOption selected = rec.selectedOption();

            out.append(SECTION_RULE).append('\n')
                    .append("Resource: ").append(rec.resourceName()).append('\n')
                    .append("Resource Group: ").append(rec.resourceGroup()).append('\n')
                    .append("CURRENT CONFIGURATION:\n")
                    .append("  SKU: ").append(sizeOf(rec.currentConfiguration())).append(" instances\n")
                    .append("  Monthly Cost: ").append(Money.format(rec.currentMonthlyCost())).append('\n');
            if (rec.workloadCount() != null) {
                out.append("  Workloads: ").append(rec.runningWorkloadCount() != null ? rec.runningWorkloadCount() : "?")
                        .append('/').append(rec.workloadCount()).append(" running\n");
            }
            out.append("  CPU: ").append(usage.cpuAvg()).append("% avg, ").append(usage.cpuMax()).append("% max\n")
                    .append("  Memory: ").append(usage.memAvg()).append("% avg, ").append(usage.memMax()).append("% max\n");

            if (selected.isCurrent()) {
                out.append("RECOMMENDATION (").append(rec.strategy()).append(" strategy): keep current configuration\n");
            } else {
                out.append("RECOMMENDED CONFIGURATION (").append(rec.strategy()).append(" strategy):\n")
                        .append("  SKU: ").append(sizeOf(selected.configuration())).append(" instances\n")
                        .append("  Monthly Cost: ").append(Money.format(selected.monthlyCost())).append('\n')
                        .append("  Monthly Savings: ").append(Money.format(rec.potentialMonthlySavings()))
                        .append(" (").append(rec.savingsPercentage()).append("%)\n")
                        .append("  Annual Savings: ").append(Money.format(rec.potentialAnnualSavings())).append('\n')
                        .append("  Selected Option: ").append(selected.kind())
                        .append(" (Risk: ").append(selected.riskLevel())
                        .append(", Confidence: ").append(selected.confidence()).append("%)\n");
            }

            memoryWarning(rec).ifPresent(warning -> out.append("  WARNING: ").append(warning).append('\n'));

            out.append("ALL AVAILABLE OPTIONS:\n");
            for (OptimizationOption option : rec.options()) {
                out.append("  ").append(option.kind() == selected.kind() ? "* " : "  ")
                        .append(truncate(option.description()))
                        .append(" | ").append(sizeOf(option.configuration()))
                        .append(" | CPU: ").append(option.projected().cpuMax()).append("% max")
                        .append(" | Mem: ").append(option.projected().memMax()).append("% max")
                        .append(" | Risk: ").append(option.riskLevel())
                        .append(" | ").append(Money.format(option.monthlyCost())).append("/mo")
                        .append(" | Savings: ").append(Money.format(option.monthlySavings()))
                        .append(option.costEstimated() ? " (est.)" : "")
                        .append('\n');
            }
        }
        out.append(SECTION_RULE).append("\n\n");
    }

    private void renderEmptyResources(StringBuilder out, AnalysisResult result) {
        section(out, "EMPTY RESOURCES (Cleanup Opportunities)");
        List<Recommendation> empty = result.recommendations().stream()
                .filter(rec -> rec.type() == RecommendationType.EMPTY_RESOURCE)
                .toList();

        if (empty.isEmpty()) {
            out.append("None found.\n\n");
            return;
        }

        for (Recommendation rec : empty) {
            out.append("Resource: ").append(rec.resourceName()).append(" (").append(rec.resourceGroup()).append(")\n")
                    .append("  Current Cost: ").append(Money.format(rec.currentMonthlyCost())).append("/month waste\n")
                    .append("  SKU: ").append(sizeOf(rec.currentConfiguration())).append('\n')
                    .append("  No workloads deployed; delete if no longer needed\n");
        }
        out.append('\n');
    }

    private void renderFindings(StringBuilder out, AnalysisResult result) {
        section(out, "FINDINGS BY FINANCIAL IMPACT");
        if (result.findings().isEmpty()) {
            out.append("No findings.\n\n");
            return;
        }
        for (Finding finding : result.findings()) {
            out.append("[severity ").append(finding.severity()).append("] ").append(finding.title()).append('\n')
                    .append("  Annual: ").append(Money.format(finding.totalAnnualSavings())).append('\n')
                    .append("  Next step: ").append(finding.nextStep()).append('\n');
        }
        out.append('\n');
    }

    private void renderNotes(StringBuilder out, AnalysisResult result) {
        section(out, "NOTES");
        out.append("1. Review the options table of each resource for alternative changes.\n")
                .append("2. Risk levels:\n");
        for (RiskLevel level : List.of(RiskLevel.LOW, RiskLevel.MEDIUM, RiskLevel.HIGH)) {
            out.append("   ").append(level).append(": ").append(level.getGuidance()).append('\n');
        }
        out.append("3. Change the strategy with rightsizing.strategy (aggressive, balanced, conservative).\n")
                .append("4. Test changes outside production first and monitor for 24-48 hours afterwards.\n");

        int note = 5;
        boolean estimated = result.recommendations().stream().anyMatch(Recommendation::usesEstimatedCost);
        if (estimated) {
            out.append(note++).append(". Some SKUs were not in the pricing catalog and were priced from an estimate")
                    .append(" (marked \"est.\"); cost totals are best-effort.\n");
        }

        List<String> incomplete = result.recommendations().stream()
                .filter(rec -> rec.currentUtilization().hasMissingMetrics())
                .map(Recommendation::resourceName)
                .toList();
        if (!incomplete.isEmpty()) {
            out.append(note++).append(". Missing utilization metrics were treated as 0 and lowered confidence for: ")
                    .append(String.join(", ", incomplete)).append('\n');
        }

        if (!result.skipped().isEmpty()) {
            out.append(note).append(". Skipped resources:\n");
            result.skipped().forEach(skip ->
                    out.append("   ").append(skip.resourceId()).append(": ").append(skip.reason()).append('\n'));
        }
    }

    static Optional<String> memoryWarning(Recommendation rec) {
        int memMax = rec.currentUtilization().memMax();
        if (memMax > MEMORY_PRESSURE) {
            return Optional.of("memory already at " + memMax + "% max; SKU downgrades are not safe");
        }
        if (rec.selectedOption().kind().isSkuDowngrade() && memMax > DOWNGRADE_MEMORY_PRESSURE) {
            return Optional.of("selected option halves memory per instance while current max memory is "
                    + memMax + "%");
        }
        return Optional.empty();
    }

    private static void section(StringBuilder out, String title) {
        out.append(title).append(":\n").append(SECTION_RULE).append('\n');
    }

    private static String sizeOf(ResourceConfiguration configuration) {
        return configuration.skuLabel() + " x" + configuration.capacity();
    }

    private static String usageOf(Recommendation rec) {
        if (rec.type() == RecommendationType.EMPTY_RESOURCE) {
            return "EMPTY (no workloads)";
        }
        UtilizationSample usage = rec.currentUtilization();
        return "CPU: " + usage.cpuAvg() + "% avg, " + usage.cpuMax() + "% max";
    }

    private static String truncate(String text) {
        return text.length() > DESCRIPTION_WIDTH ? text.substring(0, DESCRIPTION_WIDTH) + "..." : text;
    }

    private static int percentage(BigDecimal part, BigDecimal whole) {
        if (whole.signum() <= 0) {
            return 0;
        }
        return part.multiply(BigDecimal.valueOf(100)).divide(whole, 0, RoundingMode.DOWN).intValue();
    }

    private static BigDecimal sum(List<Recommendation> recommendations,
                                  Function<Recommendation, BigDecimal> amount) {
        return recommendations.stream().map(amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}

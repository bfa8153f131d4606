package com.microsoft.capacityadvisor.findings;

import com.microsoft.capacityadvisor.domain.model.Finding;
import com.microsoft.capacityadvisor.domain.model.OptimizationOption;
import com.microsoft.capacityadvisor.domain.model.OptionKind;
import com.microsoft.capacityadvisor.domain.model.Recommendation;
import com.microsoft.capacityadvisor.domain.model.RecommendationType;
import com.microsoft.capacityadvisor.domain.model.ResourceConfiguration;
import com.microsoft.capacityadvisor.domain.model.RiskLevel;
import com.microsoft.capacityadvisor.domain.model.SavingsBand;
import com.microsoft.capacityadvisor.domain.model.SavingsThresholds;
import com.microsoft.capacityadvisor.domain.model.UtilizationSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ImpactAggregator.
 *
 * Test strategy:
 * 1. Band boundaries (lower bounds inclusive)
 * 2. Partitioning: each positive-savings recommendation in exactly one finding
 * 3. Summary content and truncation
 */
class ImpactAggregatorTest {

    private final ImpactAggregator aggregator = new ImpactAggregator();

    private static Recommendation recommendation(String id, long savings) {
        return recommendation(id, savings, RecommendationType.RIGHTSIZING);
    }

    private static Recommendation recommendation(String id, long savings, RecommendationType type) {
        var configuration = new ResourceConfiguration(id, "Premium", "P3", 4, "eastus");
        var utilization = UtilizationSample.of(12, 30, 25, 40);
        var selected = OptimizationOption.builder()
                .kind(savings > 0 ? OptionKind.SCALE_DOWN_1 : OptionKind.CURRENT)
                .configuration(configuration)
                .description("test")
                .riskLevel(savings > 0 ? RiskLevel.LOW : RiskLevel.NONE)
                .confidence(85)
                .projected(utilization)
                .monthlyCost(BigDecimal.valueOf(20000 - savings))
                .monthlySavings(BigDecimal.valueOf(savings))
                .build();

        return Recommendation.builder()
                .resourceId(id)
                .resourceName(id + "-plan")
                .resourceGroup("rg-prod")
                .type(type)
                .currentConfiguration(configuration)
                .currentUtilization(utilization)
                .options(List.of(selected))
                .selectedOption(selected)
                .strategy("balanced")
                .currentMonthlyCost(BigDecimal.valueOf(20000))
                .potentialMonthlySavings(BigDecimal.valueOf(savings))
                .build();
    }

    @Nested
    @DisplayName("Banding")
    class BandingTests {

        @Test
        @DisplayName("Savings below the medium threshold should land in LOW only")
        void belowMediumShouldBeLow() {
            var findings = aggregator.aggregate(List.of(recommendation("a", 1500)), SavingsThresholds.DEFAULT);

            assertThat(findings).singleElement().satisfies(finding -> {
                assertThat(finding.band()).isEqualTo(SavingsBand.LOW);
                assertThat(finding.severity()).isEqualTo(4);
            });
        }

        @Test
        @DisplayName("Savings equal to the medium threshold should land in MEDIUM")
        void mediumLowerBoundShouldBeInclusive() {
            var findings = aggregator.aggregate(List.of(recommendation("a", 2000)), SavingsThresholds.DEFAULT);

            assertThat(findings).extracting(Finding::band).containsExactly(SavingsBand.MEDIUM);
            assertThat(findings.get(0).severity()).isEqualTo(3);
        }

        @Test
        @DisplayName("Savings equal to the high threshold should land in HIGH")
        void highLowerBoundShouldBeInclusive() {
            var findings = aggregator.aggregate(List.of(recommendation("a", 10000)), SavingsThresholds.DEFAULT);

            assertThat(findings).extracting(Finding::band).containsExactly(SavingsBand.HIGH);
            assertThat(findings.get(0).severity()).isEqualTo(2);
        }

        @Test
        @DisplayName("Zero-savings recommendations should belong to no finding")
        void zeroSavingsShouldBeExcluded() {
            var findings = aggregator.aggregate(List.of(recommendation("keep", 0)), SavingsThresholds.DEFAULT);

            assertThat(findings).isEmpty();
        }

        @Test
        @DisplayName("Should return findings in HIGH, MEDIUM, LOW order")
        void shouldOrderBySeverity() {
            var findings = aggregator.aggregate(List.of(
                    recommendation("low", 100),
                    recommendation("high", 12000),
                    recommendation("medium", 3000)), SavingsThresholds.DEFAULT);

            assertThat(findings).extracting(Finding::band)
                    .containsExactly(SavingsBand.HIGH, SavingsBand.MEDIUM, SavingsBand.LOW);
        }
    }

    @Test
    @DisplayName("Every opportunity should appear in exactly one finding and totals should add up")
    void shouldPartitionAndSum() {
        // Given
        List<Recommendation> recommendations = new ArrayList<>();
        long[] savings = {0, 50, 1999, 2000, 2500, 9999, 10000, 15000, 0, 700};
        for (int i = 0; i < savings.length; i++) {
            recommendations.add(recommendation("r" + i, savings[i]));
        }

        // When
        var findings = aggregator.aggregate(recommendations, SavingsThresholds.DEFAULT);

        // Then
        List<String> members = findings.stream().flatMap(f -> f.memberResourceIds().stream()).toList();
        assertThat(members).doesNotHaveDuplicates().hasSize(8).doesNotContain("r0", "r8");

        BigDecimal total = findings.stream().map(Finding::totalMonthlySavings).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(total).isEqualByComparingTo("42248");

        for (Finding finding : findings) {
            assertThat(finding.totalAnnualSavings())
                    .isEqualByComparingTo(finding.totalMonthlySavings().multiply(BigDecimal.valueOf(12)));
        }
    }

    @Test
    @DisplayName("Custom thresholds should move the band boundaries")
    void shouldHonourCustomThresholds() {
        var thresholds = new SavingsThresholds(BigDecimal.valueOf(500), BigDecimal.valueOf(1000));

        var findings = aggregator.aggregate(List.of(recommendation("a", 600), recommendation("b", 1000)), thresholds);

        assertThat(findings).extracting(Finding::band).containsExactly(SavingsBand.HIGH, SavingsBand.MEDIUM);
    }

    @Nested
    @DisplayName("Finding text")
    class FindingTextTests {

        @Test
        @DisplayName("Should title the finding with count and total")
        void shouldTitleFinding() {
            var findings = aggregator.aggregate(
                    List.of(recommendation("a", 6000), recommendation("b", 6000)), SavingsThresholds.DEFAULT);

            assertThat(findings.get(0).title()).isEqualTo("MEDIUM savings: 2 resource(s) could save $12,000/month");
            assertThat(findings.get(0).summary())
                    .contains("Total Potential Savings: $12,000/month ($144,000/year)")
                    .contains("a-plan (rg-prod): $6,000/month savings - Risk: LOW")
                    .contains("Current: P3 x4 | CPU: 12% avg, 30% max");
            assertThat(findings.get(0).nextStep()).isEqualTo(SavingsBand.MEDIUM.getNextStep());
        }

        @Test
        @DisplayName("Should mark empty resources in the member list")
        void shouldMarkEmptyResources() {
            var findings = aggregator.aggregate(
                    List.of(recommendation("idle", 876, RecommendationType.EMPTY_RESOURCE)), SavingsThresholds.DEFAULT);

            assertThat(findings.get(0).summary()).contains("EMPTY (no workloads)");
        }

        @Test
        @DisplayName("Should list at most 20 members in the summary but keep all in the finding")
        void shouldTruncateMemberList() {
            List<Recommendation> many = IntStream.range(0, 25)
                    .mapToObj(i -> recommendation("r" + i, 100))
                    .toList();

            var finding = aggregator.aggregate(many, SavingsThresholds.DEFAULT).get(0);

            assertThat(finding.members()).hasSize(25);
            assertThat(finding.summary()).contains("r19-plan").doesNotContain("r20-plan").contains("... and 5 more");
        }
    }
}

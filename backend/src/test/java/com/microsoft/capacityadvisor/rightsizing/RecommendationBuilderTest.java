package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.domain.model.OptionKind;
import com.microsoft.capacityadvisor.domain.model.RecommendationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationBuilderTest {

    private final RecommendationBuilder builder = new RecommendationBuilder();
    private final OptionGenerator generator = RightsizingFixtures.optionGenerator();

    @Test
    @DisplayName("Rightsizing recommendation should carry the selected option's savings")
    void shouldUseSelectedSavings() {
        // Given
        var snapshot = RightsizingFixtures.snapshot("web", "Premium", "P3", 4, 20, 35, 40, 55);
        var options = generator.generate(snapshot.configuration(), snapshot.utilizationSample());
        var selected = options.get(1);

        // When
        var recommendation = builder.build(snapshot, options, selected, "balanced");

        // Then
        assertThat(recommendation.type()).isEqualTo(RecommendationType.RIGHTSIZING);
        assertThat(recommendation.resourceName()).isEqualTo("web-plan");
        assertThat(recommendation.currentMonthlyCost()).isEqualByComparingTo("2336");
        assertThat(recommendation.potentialMonthlySavings()).isEqualByComparingTo("584");
        assertThat(recommendation.potentialAnnualSavings()).isEqualByComparingTo("7008");
        assertThat(recommendation.recommendedMonthlyCost()).isEqualByComparingTo("1752");
        assertThat(recommendation.savingsPercentage()).isEqualTo(25);
        assertThat(recommendation.options()).hasSize(options.size());
        assertThat(recommendation.strategy()).isEqualTo("balanced");
    }

    @Test
    @DisplayName("Empty resource recommendation should recover the full current cost")
    void emptyShouldRecoverFullCost() {
        var snapshot = RightsizingFixtures.emptySnapshot("idle", "Standard", "S2", 2);
        var current = generator.baseline(snapshot.configuration(), snapshot.utilizationSample());

        var recommendation = builder.buildEmpty(snapshot, current, "balanced");

        assertThat(recommendation.type()).isEqualTo(RecommendationType.EMPTY_RESOURCE);
        assertThat(recommendation.options()).extracting(o -> o.kind()).containsExactly(OptionKind.CURRENT);
        assertThat(recommendation.selectedOption()).isEqualTo(current);
        assertThat(recommendation.potentialMonthlySavings()).isEqualByComparingTo("292");
        assertThat(recommendation.savingsPercentage()).isEqualTo(100);
    }
}

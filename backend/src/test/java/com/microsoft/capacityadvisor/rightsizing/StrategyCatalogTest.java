package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.config.RightsizingProperties;
import com.microsoft.capacityadvisor.domain.model.RiskLevel;
import com.microsoft.capacityadvisor.domain.model.StrategyProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyCatalogTest {

    @Test
    @DisplayName("Should resolve built-in strategies case-insensitively")
    void shouldResolveBuiltIns() {
        var catalog = new StrategyCatalog(new RightsizingProperties());

        assertThat(catalog.resolve("Conservative")).isEqualTo(StrategyProfile.CONSERVATIVE);
        assertThat(catalog.resolve(" AGGRESSIVE ")).isEqualTo(StrategyProfile.AGGRESSIVE);
        assertThat(catalog.profiles()).extracting(StrategyProfile::name)
                .containsExactly("aggressive", "balanced", "conservative");
    }

    @Test
    @DisplayName("Unknown strategy names should fall back to balanced")
    void unknownShouldFallBackToBalanced() {
        var catalog = new StrategyCatalog(new RightsizingProperties());

        assertThat(catalog.resolve("yolo")).isEqualTo(StrategyProfile.BALANCED);
    }

    @Test
    @DisplayName("Blank names should resolve to the configured default")
    void blankShouldUseDefault() {
        var properties = new RightsizingProperties();
        properties.setStrategy("conservative");
        var catalog = new StrategyCatalog(properties);

        assertThat(catalog.resolve(null)).isEqualTo(StrategyProfile.CONSERVATIVE);
        assertThat(catalog.resolve("  ")).isEqualTo(StrategyProfile.CONSERVATIVE);
        assertThat(catalog.defaultProfile()).isEqualTo(StrategyProfile.CONSERVATIVE);
    }

    @Test
    @DisplayName("An unknown configured default should fall back to balanced")
    void unknownDefaultShouldFallBack() {
        var properties = new RightsizingProperties();
        properties.setStrategy("turbo");

        assertThat(new StrategyCatalog(properties).defaultProfile()).isEqualTo(StrategyProfile.BALANCED);
    }

    @Test
    @DisplayName("Should register strategies declared in configuration")
    void shouldRegisterConfiguredStrategies() {
        var definition = new RightsizingProperties.StrategyDefinition();
        definition.setRiskCeiling(RiskLevel.HIGH);
        definition.setMaxProjectedCpu(95);
        definition.setMaxProjectedMemory(98);
        definition.setDescription("Off-hours batch plans");

        var properties = new RightsizingProperties();
        properties.getStrategies().put("Nightly", definition);

        var profile = new StrategyCatalog(properties).resolve("nightly");

        assertThat(profile).isEqualTo(new StrategyProfile("nightly", RiskLevel.HIGH, 95, 98, "Off-hours batch plans"));
    }
}

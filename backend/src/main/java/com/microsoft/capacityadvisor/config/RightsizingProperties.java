package com.microsoft.capacityadvisor.config;

import com.microsoft.capacityadvisor.domain.model.RiskLevel;
import com.microsoft.capacityadvisor.domain.model.SavingsThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under {@code rightsizing.*}.
 *
 * Every value has a default so the engine runs with an empty configuration.
 */
@ConfigurationProperties(prefix = "rightsizing")
@Validated
@Getter
@Setter
public class RightsizingProperties {

    /**
     * Strategy used when a request does not name one: aggressive, balanced or conservative.
     */
    private String strategy = "balanced";

    @Valid
    private Thresholds thresholds = new Thresholds();

    @Valid
    private Executor executor = new Executor();

    @Valid
    private Pricing pricing = new Pricing();

    @Valid
    private Batch batch = new Batch();

    /**
     * Additional strategy profiles keyed by name.
     */
    @Valid
    private Map<String, StrategyDefinition> strategies = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Thresholds {

        @NotNull
        @DecimalMin("0")
        private BigDecimal medium = BigDecimal.valueOf(2000);

        @NotNull
        @DecimalMin("0")
        private BigDecimal high = BigDecimal.valueOf(10000);

        public SavingsThresholds toSavingsThresholds() {
            return new SavingsThresholds(medium, high);
        }
    }

    @Getter
    @Setter
    public static class Executor {

        /**
         * Worker threads analysing resources. Kept small to respect the
         * metrics collaborator's rate limits.
         */
        @Min(1)
        private int poolSize = 4;

        @Min(0)
        private int queueCapacity = 1000;

        @NotNull
        private Duration resourceTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Pricing {

        @NotBlank
        private String catalog = "classpath:pricing/app-service-plan-pricing.json";
    }

    @Getter
    @Setter
    public static class Batch {

        /**
         * Snapshot JSON to analyse at startup. The batch runner is disabled when unset.
         */
        private String snapshotFile;

        @NotBlank
        private String outputDirectory = "rightsizing-output";
    }

    @Getter
    @Setter
    public static class StrategyDefinition {

        @NotNull
        private RiskLevel riskCeiling = RiskLevel.MEDIUM;

        @Min(0)
        @Max(100)
        private int maxProjectedCpu = 85;

        @Min(0)
        @Max(100)
        private int maxProjectedMemory = 90;

        private String description;
    }
}

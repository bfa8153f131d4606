package com.microsoft.capacityadvisor.api;

import com.microsoft.capacityadvisor.domain.model.AnalysisResult;
import com.microsoft.capacityadvisor.domain.model.Finding;
import com.microsoft.capacityadvisor.domain.model.Recommendation;
import com.microsoft.capacityadvisor.domain.model.ResourceSnapshot;
import com.microsoft.capacityadvisor.domain.model.RiskLevel;
import com.microsoft.capacityadvisor.domain.model.SavingsThresholds;
import com.microsoft.capacityadvisor.report.TextReportRenderer;
import com.microsoft.capacityadvisor.rightsizing.RightsizingEngine;
import com.microsoft.capacityadvisor.rightsizing.StrategyCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * REST API for on-demand rightsizing analysis.
 *
 * The caller supplies the resource snapshots inline together with an optional
 * strategy and savings thresholds; omitted policy values use the configured
 * defaults. Nothing is persisted.
 */
@RestController
@RequestMapping("/api/rightsizing")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Rightsizing API", description = "Capacity rightsizing analysis for App Service Plans")
public class RightsizingController {

    private final RightsizingEngine engine;
    private final StrategyCatalog strategyCatalog;
    private final TextReportRenderer reportRenderer;

    @PostMapping("/analyze")
    @Operation(summary = "Analyze resources",
               description = "Generates rightsizing options for each resource, selects one per the strategy "
                       + "and groups savings into findings")
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
        log.info("Rightsizing request: {} resource(s), strategy={}", request.resources().size(), request.strategy());

        SavingsThresholds thresholds = request.thresholds() != null ? request.thresholds().toSavingsThresholds() : null;
        AnalysisResult result = engine.analyze(request.resources(), request.strategy(), thresholds);

        return ResponseEntity.ok(new AnalyzeResponse(
                result.policy().strategy().name(),
                result.recommendations(),
                result.findings(),
                result.skipped(),
                result.totalMonthlySavings(),
                reportRenderer.render(result)
        ));
    }

    @GetMapping("/strategies")
    @Operation(summary = "List strategies", description = "Returns the strategy profiles available for analysis")
    public ResponseEntity<List<StrategyResponse>> strategies() {
        String defaultName = strategyCatalog.defaultProfile().name();
        return ResponseEntity.ok(strategyCatalog.profiles().stream()
                .map(profile -> new StrategyResponse(
                        profile.name(),
                        profile.riskCeiling(),
                        profile.maxProjectedCpu(),
                        profile.maxProjectedMemory(),
                        profile.description(),
                        profile.name().equals(defaultName)))
                .toList());
    }

    // DTOs

    public record AnalyzeRequest(
            String strategy,
            @Valid ThresholdsRequest thresholds,
            @NotEmpty List<@NotNull @Valid ResourceSnapshot> resources
    ) {}

    public record ThresholdsRequest(
            @NotNull @DecimalMin("0") BigDecimal medium,
            @NotNull @DecimalMin("0") BigDecimal high
    ) {
        SavingsThresholds toSavingsThresholds() {
            return new SavingsThresholds(medium, high);
        }
    }

    public record AnalyzeResponse(
            String strategy,
            List<Recommendation> recommendations,
            List<Finding> findings,
            List<AnalysisResult.SkippedResource> skipped,
            BigDecimal totalMonthlySavings,
            String report
    ) {}

    public record StrategyResponse(
            String name,
            RiskLevel riskCeiling,
            int maxProjectedCpu,
            int maxProjectedMemory,
            String description,
            boolean defaultStrategy
    ) {}
}

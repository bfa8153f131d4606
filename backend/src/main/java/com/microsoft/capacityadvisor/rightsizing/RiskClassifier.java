package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.domain.model.OptionKind;
import com.microsoft.capacityadvisor.domain.model.RiskLevel;
import com.microsoft.capacityadvisor.domain.model.UtilizationSample;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Rates a candidate's risk of exhausting the resource and how much the
 * rating can be trusted.
 *
 * RULES (first match wins):
 * 1. CURRENT is NONE / 100.
 * 2. Current max memory above 90% and the candidate shrinks the SKU: HIGH.
 *    An already memory-saturated resource is never safe to shrink further.
 * 3. Projected max CPU above 90% or projected max memory above 95%: HIGH.
 * 4. Projected max CPU above 80% or projected max memory above 85%: MEDIUM.
 * 5. Otherwise LOW.
 *
 * Memory limits sit lower than CPU limits: memory exhaustion fails hard,
 * CPU saturation throttles.
 *
 * CONFIDENCE:
 * Looked up per option kind and risk level, then lowered by 10 points for
 * every metric missing from the source sample (floor 10). Missing metrics are
 * read as 0, which makes the projection optimistic.
 */
@Component
public class RiskClassifier {

    static final int SATURATED_MEMORY = 90;
    static final int HIGH_RISK_CPU = 90;
    static final int HIGH_RISK_MEMORY = 95;
    static final int MEDIUM_RISK_CPU = 80;
    static final int MEDIUM_RISK_MEMORY = 85;

    static final int SATURATED_MEMORY_CONFIDENCE = 30;
    static final int MISSING_METRIC_PENALTY = 10;
    static final int MINIMUM_CONFIDENCE = 10;

    private static final Map<OptionKind, ConfidenceProfile> CONFIDENCE = new EnumMap<>(Map.of(
            OptionKind.SCALE_DOWN_1, new ConfidenceProfile(50, 70, 85),
            OptionKind.SCALE_DOWN_50, new ConfidenceProfile(50, 70, 80),
            OptionKind.SKU_DOWNGRADE, new ConfidenceProfile(45, 60, 85),
            OptionKind.COMBINED, new ConfidenceProfile(45, 65, 80)
    ));

    public Assessment classify(OptionKind kind, UtilizationSample current, UtilizationSample projected) {
        if (kind == OptionKind.CURRENT) {
            return new Assessment(RiskLevel.NONE, 100);
        }

        ConfidenceProfile profile = CONFIDENCE.get(kind);
        Assessment assessment;

        if (current.memMax() > SATURATED_MEMORY && kind.isSkuDowngrade()) {
            assessment = new Assessment(RiskLevel.HIGH, SATURATED_MEMORY_CONFIDENCE);
        } else if (projected.cpuMax() > HIGH_RISK_CPU || projected.memMax() > HIGH_RISK_MEMORY) {
            assessment = new Assessment(RiskLevel.HIGH, profile.high());
        } else if (projected.cpuMax() > MEDIUM_RISK_CPU || projected.memMax() > MEDIUM_RISK_MEMORY) {
            assessment = new Assessment(RiskLevel.MEDIUM, profile.medium());
        } else {
            assessment = new Assessment(RiskLevel.LOW, profile.low());
        }

        int penalty = current.missingMetrics().size() * MISSING_METRIC_PENALTY;
        if (penalty == 0) {
            return assessment;
        }
        return new Assessment(assessment.riskLevel(), Math.max(MINIMUM_CONFIDENCE, assessment.confidence() - penalty));
    }

    public record Assessment(RiskLevel riskLevel, int confidence) {}

    private record ConfidenceProfile(int high, int medium, int low) {}
}

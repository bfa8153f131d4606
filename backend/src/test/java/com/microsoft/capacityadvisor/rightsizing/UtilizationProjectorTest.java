package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.domain.model.UtilizationMetric;
import com.microsoft.capacityadvisor.domain.model.UtilizationSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UtilizationProjectorTest {

    private final UtilizationProjector projector = new UtilizationProjector();

    @Test
    @DisplayName("Should scale utilization inversely with capacity and round")
    void shouldScaleInverselyWithCapacity() {
        // Given
        var current = UtilizationSample.of(20, 35, 40, 55);

        // When
        var projected = projector.project(current, 4, 3, UtilizationProjector.SAME_SKU_FACTOR);

        // Then: 35 * 4 / 3 = 46.67, 55 * 4 / 3 = 73.33
        assertThat(projected).isEqualTo(UtilizationSample.of(27, 47, 53, 73));
    }

    @Test
    @DisplayName("Should double utilization for a SKU downgrade at the same capacity")
    void shouldApplySkuFactor() {
        var current = UtilizationSample.of(10, 20, 20, 30);

        var projected = projector.project(current, 4, 4, UtilizationProjector.SKU_DOWNGRADE_FACTOR);

        assertThat(projected).isEqualTo(UtilizationSample.of(20, 40, 40, 60));
    }

    @Test
    @DisplayName("Should clamp projections at 100%")
    void shouldClampAtHundred() {
        var current = UtilizationSample.of(60, 80, 70, 90);

        var projected = projector.project(current, 4, 1, UtilizationProjector.SKU_DOWNGRADE_FACTOR);

        assertThat(projected).isEqualTo(UtilizationSample.of(100, 100, 100, 100));
    }

    @Test
    @DisplayName("Projection should never increase as the new capacity grows")
    void shouldBeMonotonicInCapacity() {
        var current = UtilizationSample.of(13, 37, 29, 61);

        for (int skuFactor = 1; skuFactor <= 2; skuFactor++) {
            UtilizationSample previous = projector.project(current, 10, 1, skuFactor);
            for (int newCapacity = 2; newCapacity <= 20; newCapacity++) {
                UtilizationSample next = projector.project(current, 10, newCapacity, skuFactor);
                for (UtilizationMetric metric : UtilizationMetric.values()) {
                    assertThat(next.get(metric))
                            .as("%s at capacity %d, sku factor %d", metric, newCapacity, skuFactor)
                            .isLessThanOrEqualTo(previous.get(metric));
                }
                previous = next;
            }
        }
    }

    @Test
    @DisplayName("Should keep the missing-metric set of the source sample")
    void shouldKeepMissingMetrics() {
        var current = UtilizationSample.fromMetrics(20, null, 30, 40);

        var projected = projector.project(current, 2, 1, UtilizationProjector.SAME_SKU_FACTOR);

        assertThat(projected.missingMetrics()).containsExactly(UtilizationMetric.CPU_MAX);
        assertThat(projected.cpuMax()).isZero();
    }

    @Test
    @DisplayName("Should reject capacities below one")
    void shouldRejectInvalidCapacity() {
        var current = UtilizationSample.of(10, 10, 10, 10);

        assertThatThrownBy(() -> projector.project(current, 2, 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.microsoft.capacityadvisor.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UtilizationSampleTest {

    @Test
    @DisplayName("Should clamp values into 0..100")
    void shouldClamp() {
        var sample = UtilizationSample.of(-5, 130, 50, 100);

        assertThat(sample).isEqualTo(UtilizationSample.of(0, 100, 50, 100));
    }

    @Test
    @DisplayName("Should record absent metrics as zero and missing")
    void shouldTrackMissingMetrics() {
        var sample = UtilizationSample.fromMetrics(12, null, null, 40);

        assertThat(sample.cpuMax()).isZero();
        assertThat(sample.memAvg()).isZero();
        assertThat(sample.missingMetrics())
                .containsExactlyInAnyOrder(UtilizationMetric.CPU_MAX, UtilizationMetric.MEMORY_AVG);
        assertThat(sample.hasMissingMetrics()).isTrue();
        assertThat(UtilizationSample.fromMetrics(1, 2, 3, 4).hasMissingMetrics()).isFalse();
    }

    @Test
    @DisplayName("Should read metrics by name")
    void shouldReadByMetric() {
        var sample = UtilizationSample.of(1, 2, 3, 4);

        assertThat(sample.get(UtilizationMetric.CPU_AVG)).isEqualTo(1);
        assertThat(sample.get(UtilizationMetric.MEMORY_MAX)).isEqualTo(4);
    }
}

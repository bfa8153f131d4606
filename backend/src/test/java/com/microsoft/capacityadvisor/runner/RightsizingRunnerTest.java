package com.microsoft.capacityadvisor.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.capacityadvisor.config.RightsizingProperties;
import com.microsoft.capacityadvisor.report.ReportWriter;
import com.microsoft.capacityadvisor.report.TextReportRenderer;
import com.microsoft.capacityadvisor.rightsizing.RightsizingFixtures;
import com.microsoft.capacityadvisor.snapshot.SnapshotLoadException;
import com.microsoft.capacityadvisor.snapshot.SnapshotLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RightsizingRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RightsizingRunner runner(RightsizingProperties properties) {
        return new RightsizingRunner(
                new SnapshotLoader(objectMapper),
                RightsizingFixtures.engine(properties, Runnable::run),
                new ReportWriter(objectMapper, new TextReportRenderer()),
                properties);
    }

    @Test
    @DisplayName("Should analyse the snapshot file and write all outputs")
    void shouldRunBatch(@TempDir Path dir) throws IOException {
        // Given
        Path snapshotFile = dir.resolve("plans.json");
        try (InputStream in = getClass().getResourceAsStream("/snapshots/app-service-plans.json")) {
            Files.copy(in, snapshotFile);
        }
        var properties = new RightsizingProperties();
        properties.getBatch().setSnapshotFile(snapshotFile.toString());
        properties.getBatch().setOutputDirectory(dir.resolve("out").toString());

        // When
        runner(properties).run();

        // Then
        assertThat(dir.resolve("out").resolve(ReportWriter.RECOMMENDATIONS_FILE)).exists();
        assertThat(dir.resolve("out").resolve(ReportWriter.FINDINGS_FILE)).exists();
        assertThat(Files.readString(dir.resolve("out").resolve(ReportWriter.REPORT_FILE)))
                .contains("asp-web-prod")
                .contains("asp-legacy")
                .contains("Optimization Strategy: balanced");
    }

    @Test
    @DisplayName("Should fail the run when the snapshot file is missing")
    void shouldFailOnMissingSnapshot(@TempDir Path dir) {
        var properties = new RightsizingProperties();
        properties.getBatch().setSnapshotFile(dir.resolve("missing.json").toString());
        properties.getBatch().setOutputDirectory(dir.resolve("out").toString());

        assertThatThrownBy(() -> runner(properties).run())
                .isInstanceOf(SnapshotLoadException.class);
        assertThat(dir.resolve("out")).doesNotExist();
    }
}

package com.microsoft.capacityadvisor.runner;

import com.microsoft.capacityadvisor.config.RightsizingProperties;
import com.microsoft.capacityadvisor.domain.model.AnalysisResult;
import com.microsoft.capacityadvisor.domain.model.ResourceSnapshot;
import com.microsoft.capacityadvisor.report.Money;
import com.microsoft.capacityadvisor.report.ReportWriter;
import com.microsoft.capacityadvisor.rightsizing.RightsizingEngine;
import com.microsoft.capacityadvisor.snapshot.SnapshotLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Batch entry point: analyses the snapshot file named by
 * {@code rightsizing.batch.snapshot-file} on startup and writes the reports.
 *
 * Not registered when the property is unset, so the REST API can run alone.
 */
@Component
@ConditionalOnProperty(prefix = "rightsizing.batch", name = "snapshot-file")
@RequiredArgsConstructor
@Slf4j
public class RightsizingRunner implements CommandLineRunner {

    private final SnapshotLoader snapshotLoader;
    private final RightsizingEngine engine;
    private final ReportWriter reportWriter;
    private final RightsizingProperties properties;

    @Override
    public void run(String... args) {
        Path snapshotFile = Path.of(properties.getBatch().getSnapshotFile());
        Path outputDirectory = Path.of(properties.getBatch().getOutputDirectory());

        log.info("Starting batch rightsizing run for {}", snapshotFile);

        List<ResourceSnapshot> snapshots = snapshotLoader.load(snapshotFile);
        AnalysisResult result = engine.analyze(snapshots, properties.getStrategy(), null);
        reportWriter.write(result, outputDirectory);

        log.info("Batch run finished: {} opportunity(ies), potential savings {}/month, {} skipped",
                result.opportunities().size(), Money.format(result.totalMonthlySavings()), result.skipped().size());
    }
}

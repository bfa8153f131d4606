package com.microsoft.capacityadvisor.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.microsoft.capacityadvisor.domain.model.AnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the outcome of one run into an output directory:
 * recommendations.json, findings.json and report.txt.
 *
 * Everything is serialized once from the completed result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReportWriter {

    public static final String RECOMMENDATIONS_FILE = "recommendations.json";
    public static final String FINDINGS_FILE = "findings.json";
    public static final String REPORT_FILE = "report.txt";

    private final ObjectMapper objectMapper;
    private final TextReportRenderer renderer;

    public void write(AnalysisResult result, Path outputDirectory) {
        ObjectWriter writer = objectMapper.writerWithDefaultPrettyPrinter();

        Map<String, Object> recommendations = new LinkedHashMap<>();
        recommendations.put("strategy", result.policy().strategy().name());
        recommendations.put("recommendations", result.recommendations());
        recommendations.put("skipped", result.skipped());

        try {
            Files.createDirectories(outputDirectory);
            writer.writeValue(outputDirectory.resolve(RECOMMENDATIONS_FILE).toFile(), recommendations);
            writer.writeValue(outputDirectory.resolve(FINDINGS_FILE).toFile(), result.findings());
            Files.writeString(outputDirectory.resolve(REPORT_FILE), renderer.render(result), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write report to " + outputDirectory, e);
        }

        log.info("Wrote {} recommendation(s) and {} finding(s) to {}",
                result.recommendations().size(), result.findings().size(), outputDirectory.toAbsolutePath());
    }
}

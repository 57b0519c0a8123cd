package com.powerwatch.backup.ingest.config;

import com.powerwatch.backup.etl.normalize.TextNormalizer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for one backup analysis run.
 *
 * All properties use the "ingest.*" prefix and have defaults matching the mailbox drop layout, so a
 * run needs no arguments. Input files are not checked here: a missing input fails the run, not startup.
 */
@ConfigurationProperties(prefix = "ingest")
@Validated
public class IngestConfig {
    private static final Logger log = LoggerFactory.getLogger(IngestConfig.class);

    private String inputDir = ".";
    private String alarmsFile = "LOGS DE AE SEMANA 01-2025.xlsx";
    private String outagesFile = "nodeb_unavailable_2025 01.csv";
    private String databaseUrl = "jdbc:sqlite:etl_alarms.db";
    private String outputDir = ".";
    private String joinedCsvFile = "resultados_joined.csv";
    private String reportFile = "report.json";
    private String failureFile = "failures.jsonl";
    private String targetAlarmClass = "MINOR RECT FAILURE";
    private String alternateOccurrenceSheet = "PENINSULA";
    private int topAlarmLimit = 20;

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        List<String> errors = new ArrayList<>();
        requireText(errors, "ingest.input-dir", inputDir);
        requireText(errors, "ingest.alarms-file", alarmsFile);
        requireText(errors, "ingest.outages-file", outagesFile);
        requireText(errors, "ingest.database-url", databaseUrl);
        requireText(errors, "ingest.output-dir", outputDir);
        requireText(errors, "ingest.joined-csv-file", joinedCsvFile);
        requireText(errors, "ingest.report-file", reportFile);
        requireText(errors, "ingest.failure-file", failureFile);
        requireText(errors, "ingest.target-alarm-class", targetAlarmClass);
        requireText(errors, "ingest.alternate-occurrence-sheet", alternateOccurrenceSheet);

        if (!errors.isEmpty()) {
            String errorMsg = "Missing required configuration properties:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        // alarm names are compared in normalized form
        targetAlarmClass = TextNormalizer.normalize(targetAlarmClass);
        if (targetAlarmClass.isEmpty()) {
            errors.add("ingest.target-alarm-class has no letters or digits");
        }
        if (!databaseUrl.startsWith("jdbc:")) {
            errors.add("ingest.database-url is not a JDBC url: " + databaseUrl);
        }
        if (topAlarmLimit < 0) {
            errors.add("ingest.top-alarm-limit must not be negative: " + topAlarmLimit);
        }

        Path outputPath = Path.of(outputDir);
        try {
            Files.createDirectories(outputPath);
            if (!Files.isWritable(outputPath)) {
                errors.add("Output directory is not writable: " + outputDir);
            }
        } catch (IOException e) {
            errors.add("Cannot create output directory: " + outputDir + " - " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Alarm workbook: {}", getAlarmsPath());
        log.info("Outage table: {}", getOutagesPath());
        log.info("Database: {}", databaseUrl);
        log.info("Joined CSV: {}", getJoinedCsvPath());
        log.info("Report: {}", getReportPath());
        log.info("Failure file: {}", getFailurePath());
        log.info("Target alarm class: {}", targetAlarmClass);
        log.info("Alternate occurrence sheet: {}", alternateOccurrenceSheet);
        log.info("Top alarm limit: {}", topAlarmLimit);
        log.info("================================");
    }

    private static void requireText(List<String> errors, String property, String value) {
        if (value == null || value.isBlank()) {
            errors.add(property + " is required");
        }
    }

    public Path getAlarmsPath() {
        return Path.of(inputDir).resolve(alarmsFile);
    }

    public Path getOutagesPath() {
        return Path.of(inputDir).resolve(outagesFile);
    }

    public Path getJoinedCsvPath() {
        return Path.of(outputDir).resolve(joinedCsvFile);
    }

    public Path getReportPath() {
        return Path.of(outputDir).resolve(reportFile);
    }

    public Path getFailurePath() {
        return Path.of(outputDir).resolve(failureFile);
    }

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(String inputDir) {
        this.inputDir = inputDir;
    }

    public String getAlarmsFile() {
        return alarmsFile;
    }

    public void setAlarmsFile(String alarmsFile) {
        this.alarmsFile = alarmsFile;
    }

    public String getOutagesFile() {
        return outagesFile;
    }

    public void setOutagesFile(String outagesFile) {
        this.outagesFile = outagesFile;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getJoinedCsvFile() {
        return joinedCsvFile;
    }

    public void setJoinedCsvFile(String joinedCsvFile) {
        this.joinedCsvFile = joinedCsvFile;
    }

    public String getReportFile() {
        return reportFile;
    }

    public void setReportFile(String reportFile) {
        this.reportFile = reportFile;
    }

    public String getFailureFile() {
        return failureFile;
    }

    public void setFailureFile(String failureFile) {
        this.failureFile = failureFile;
    }

    public String getTargetAlarmClass() {
        return targetAlarmClass;
    }

    public void setTargetAlarmClass(String targetAlarmClass) {
        this.targetAlarmClass = targetAlarmClass;
    }

    public String getAlternateOccurrenceSheet() {
        return alternateOccurrenceSheet;
    }

    public void setAlternateOccurrenceSheet(String alternateOccurrenceSheet) {
        this.alternateOccurrenceSheet = alternateOccurrenceSheet;
    }

    public int getTopAlarmLimit() {
        return topAlarmLimit;
    }

    public void setTopAlarmLimit(int topAlarmLimit) {
        this.topAlarmLimit = topAlarmLimit;
    }
}

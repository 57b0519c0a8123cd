package com.powerwatch.backup.ingest;

import com.powerwatch.backup.etl.failure.FailureSink;
import com.powerwatch.backup.etl.failure.LoggingFailureReporter;
import com.powerwatch.backup.ingest.config.IngestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.UUID;

/**
 * Rectifier alarm to outage battery backup analysis.
 *
 * Orchestrates:
 * - alarm workbook and outage table ingestion
 * - the site and time join
 * - replacing the stored alarm, outage and joined tables
 * - the joined CSV dump and the aggregate report
 *
 * Run with no arguments to use the defaults, or override any property:
 * java -jar ingest-service.jar \
 *   --ingest.input-dir=/data/mailbox \
 *   --ingest.database-url=jdbc:sqlite:/data/etl_alarms.db \
 *   --ingest.output-dir=/data/out
 */
@SpringBootApplication(exclude = {
    org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration.class
})
@ConfigurationPropertiesScan("com.powerwatch.backup.ingest.config")
public class BackupAnalysisApplication implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(BackupAnalysisApplication.class);

    private final IngestConfig config;

    private int exitCode;

    public BackupAnalysisApplication(IngestConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(BackupAnalysisApplication.class);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting battery backup analysis");

        String runId = UUID.randomUUID().toString();
        log.info("Run ID: {}", runId);

        RunSummary summary;
        try (FailureSink failureSink = new FailureSink(config.getFailurePath(), new LoggingFailureReporter())) {
            summary = BackupPipeline.fromConfig(runId, config, failureSink).run();
        }

        if (summary.success()) {
            log.info("=== ANALYSIS COMPLETE ===");
            log.info("Alarms stored: {}", summary.alarmCount());
            log.info("Outages stored: {}", summary.outageCount());
            log.info("Joined rows stored: {}", summary.joinedCount());
            log.info("Joined CSV: {}", config.getJoinedCsvPath());
            log.info("Report: {}", config.getReportPath());
        } else {
            log.error("=== ANALYSIS FAILED ===");
            log.error("Reason: {}", summary.failureMessage());
        }
        log.info("Run ID: {}", runId);
        log.info("Total failures: {}", summary.failureCount());
        log.info("Duration: {} seconds", summary.elapsed().toSeconds());
        log.info("Failures: {}", config.getFailurePath());

        exitCode = summary.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

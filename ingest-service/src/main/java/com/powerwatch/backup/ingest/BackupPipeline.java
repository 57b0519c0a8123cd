package com.powerwatch.backup.ingest;

import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.data.record.JoinedRecord;
import com.powerwatch.backup.data.record.OutageRecord;
import com.powerwatch.backup.data.schema.EntityKind;
import com.powerwatch.backup.etl.failure.FailureReason;
import com.powerwatch.backup.etl.failure.FailureRecord;
import com.powerwatch.backup.etl.failure.FailureReporter;
import com.powerwatch.backup.etl.ingest.AlarmIngestor;
import com.powerwatch.backup.etl.ingest.OutageIngestor;
import com.powerwatch.backup.etl.normalize.SiteIdentifierResolver;
import com.powerwatch.backup.etl.source.TabularSourceReader;
import com.powerwatch.backup.etl.source.TimestampParser;
import com.powerwatch.backup.exception.PersistenceFailureException;
import com.powerwatch.backup.ingest.config.IngestConfig;
import com.powerwatch.backup.ingest.input.ConfiguredInputLocator;
import com.powerwatch.backup.ingest.input.InputLocator;
import com.powerwatch.backup.processing.io.JoinedCsvExporter;
import com.powerwatch.backup.processing.io.ReportJsonWriter;
import com.powerwatch.backup.processing.join.TemporalJoinEngine;
import com.powerwatch.backup.processing.report.BackupReport;
import com.powerwatch.backup.processing.report.ReportingAggregator;
import com.powerwatch.backup.writer.JdbcPersistenceGateway;
import com.powerwatch.backup.writer.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One run: ingest both sources, join, replace the stored sets, read them back, export and aggregate.
 *
 * Nothing is persisted unless both sources produced a result.
 */
public class BackupPipeline {
    private static final Logger log = LoggerFactory.getLogger(BackupPipeline.class);

    private final String runId;
    private final InputLocator inputLocator;
    private final AlarmIngestor alarmIngestor;
    private final OutageIngestor outageIngestor;
    private final TemporalJoinEngine joinEngine;
    private final PersistenceGateway gateway;
    private final ReportingAggregator aggregator;
    private final JoinedCsvExporter csvExporter;
    private final ReportJsonWriter reportWriter;
    private final FailureReporter failureReporter;
    private final Path joinedCsvPath;
    private final Path reportPath;
    private final int topAlarmLimit;

    public BackupPipeline(String runId, InputLocator inputLocator, AlarmIngestor alarmIngestor,
                          OutageIngestor outageIngestor, TemporalJoinEngine joinEngine, PersistenceGateway gateway,
                          ReportingAggregator aggregator, JoinedCsvExporter csvExporter, ReportJsonWriter reportWriter,
                          FailureReporter failureReporter, Path joinedCsvPath, Path reportPath, int topAlarmLimit) {
        this.runId = runId;
        this.inputLocator = inputLocator;
        this.alarmIngestor = alarmIngestor;
        this.outageIngestor = outageIngestor;
        this.joinEngine = joinEngine;
        this.gateway = gateway;
        this.aggregator = aggregator;
        this.csvExporter = csvExporter;
        this.reportWriter = reportWriter;
        this.failureReporter = failureReporter;
        this.joinedCsvPath = joinedCsvPath;
        this.reportPath = reportPath;
        this.topAlarmLimit = topAlarmLimit;
    }

    public static BackupPipeline fromConfig(String runId, IngestConfig config, FailureReporter failureReporter) {
        return new BackupPipeline(
            runId,
            new ConfiguredInputLocator(config),
            new AlarmIngestor(runId, failureReporter, new TabularSourceReader(),
                new SiteIdentifierResolver(),
                new TimestampParser(), config.getAlternateOccurrenceSheet()),
            new OutageIngestor(runId, failureReporter),
            new TemporalJoinEngine(config.getTargetAlarmClass()),
            new JdbcPersistenceGateway(config.getDatabaseUrl()),
            new ReportingAggregator(config.getTargetAlarmClass()),
            new JoinedCsvExporter(),
            new ReportJsonWriter(),
            failureReporter,
            config.getJoinedCsvPath(),
            config.getReportPath(),
            config.getTopAlarmLimit()
        );
    }

    public RunSummary run() {
        Instant start = Instant.now();
        InputLocator.InputFiles inputs = inputLocator.locate();

        Optional<List<AlarmRecord>> alarms = alarmIngestor.ingest(inputs.alarmsWorkbook());
        Optional<List<OutageRecord>> outages = outageIngestor.ingest(inputs.outageTable());
        if (alarms.isEmpty() || outages.isEmpty()) {
            List<String> unusable = new ArrayList<>(2);
            if (alarms.isEmpty()) {
                unusable.add("alarm workbook " + inputs.alarmsWorkbook());
            }
            if (outages.isEmpty()) {
                unusable.add("outage table " + inputs.outageTable());
            }
            String message = String.join(" and ", unusable) + " produced no result, nothing was persisted";
            log.error("Run {} aborted: {}", runId, message);
            return RunSummary.failed(runId, failureReporter.getTotalFailures(), elapsedSince(start), message);
        }

        List<JoinedRecord> joined = joinEngine.join(alarms.get(), outages.get());

        try {
            gateway.saveAlarms(alarms.get());
            gateway.saveOutages(outages.get());
            gateway.saveJoined(joined);
        } catch (PersistenceFailureException e) {
            failureReporter.recordFailure(FailureRecord.forSource(
                runId, FailureRecord.SourceType.STORE, e.getTable(), FailureReason.PERSISTENCE_ERROR, e.getMessage()
            ));
            log.error("Run {} aborted while saving {}", runId, e.getTable(), e);
            return RunSummary.failed(runId, failureReporter.getTotalFailures(), elapsedSince(start), e.getMessage());
        }

        List<AlarmRecord> storedAlarms = gateway.loadAlarms();
        List<JoinedRecord> storedJoined = gateway.loadJoined();
        int storedOutages = gateway.count(EntityKind.OUTAGES);

        try {
            csvExporter.export(storedJoined, joinedCsvPath);
            BackupReport report = aggregator.summarize(storedAlarms, storedJoined, topAlarmLimit);
            reportWriter.write(report, reportPath);
        } catch (UncheckedIOException e) {
            failureReporter.recordFailure(FailureRecord.forSource(
                runId, FailureRecord.SourceType.EXPORT, null, FailureReason.EXPORT_ERROR, e.getMessage()
            ));
            log.error("Run {} could not write its exports", runId, e);
            return RunSummary.failed(runId, failureReporter.getTotalFailures(), elapsedSince(start),
                "Export failed: " + e.getMessage());
        }

        return new RunSummary(runId, true, storedAlarms.size(), storedOutages, storedJoined.size(),
            failureReporter.getTotalFailures(), elapsedSince(start), null);
    }

    private static Duration elapsedSince(Instant start) {
        return Duration.between(start, Instant.now());
    }
}

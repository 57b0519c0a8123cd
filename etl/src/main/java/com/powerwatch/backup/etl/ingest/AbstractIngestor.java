package com.powerwatch.backup.etl.ingest;

import com.powerwatch.backup.etl.failure.FailureReason;
import com.powerwatch.backup.etl.failure.FailureRecord;
import com.powerwatch.backup.etl.failure.FailureReporter;
import com.powerwatch.backup.etl.normalize.SiteIdentifierResolver;
import com.powerwatch.backup.etl.normalize.TextNormalizer;
import com.powerwatch.backup.etl.source.CellValues;
import com.powerwatch.backup.etl.source.NullSentinelDetector;
import com.powerwatch.backup.etl.source.TabularRow;
import com.powerwatch.backup.etl.source.TabularSourceReader;
import com.powerwatch.backup.etl.source.TimestampParser;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Field conversion shared by the alarm and outage ingestors: day-first timestamps that degrade to
 * null, normalized text, and site resolution.
 */
abstract class AbstractIngestor {

    static final String OCCURRED_ON = "Occurred On (NT)";
    static final String CLEARED_ON = "Cleared On (NT)";
    static final String NAME = "Name";

    protected final String runId;
    protected final FailureReporter failureReporter;
    protected final TabularSourceReader sourceReader;
    protected final SiteIdentifierResolver siteResolver;
    protected final TimestampParser timestampParser;
    protected final NullSentinelDetector nullSentinelDetector;

    AbstractIngestor(String runId, FailureReporter failureReporter, TabularSourceReader sourceReader,
                     SiteIdentifierResolver siteResolver, TimestampParser timestampParser) {
        this.runId = runId;
        this.failureReporter = failureReporter;
        this.sourceReader = sourceReader;
        this.siteResolver = siteResolver;
        this.timestampParser = timestampParser;
        this.nullSentinelDetector = new NullSentinelDetector();
    }

    protected abstract FailureRecord.SourceType sourceType();

    /**
     * Reads a timestamp cell. Sentinel cells are null; anything else that does not parse is reported and
     * becomes null.
     */
    protected @Nullable LocalDateTime timestamp(Path source, @Nullable String sheet, TabularRow row, int columnIndex, String column) {
        Object raw = row.get(columnIndex);
        if (nullSentinelDetector.isNullSentinel(raw)) {
            return null;
        }
        Optional<LocalDateTime> parsed = timestampParser.parse(raw);
        if (parsed.isEmpty()) {
            failureReporter.recordFailure(new FailureRecord(
                runId, sourceType(), source.toString(), sheet, row.rowNumber(), column, String.valueOf(raw),
                FailureReason.INVALID_TIMESTAMP, "Value does not match any day-first date format"
            ));
            return null;
        }
        return parsed.get();
    }

    protected String normalizedText(TabularRow row, int columnIndex) {
        return TextNormalizer.normalize(CellValues.asText(row.get(columnIndex)));
    }

    protected String resolveSite(String normalizedLabel) {
        return siteResolver.resolve(normalizedLabel);
    }

    protected void reportSourceFailure(Path source, FailureReason reason, String detail) {
        failureReporter.recordFailure(FailureRecord.forSource(runId, sourceType(), source.toString(), reason, detail));
    }
}

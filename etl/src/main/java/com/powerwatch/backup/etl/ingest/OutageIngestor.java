package com.powerwatch.backup.etl.ingest;

import com.powerwatch.backup.data.record.OutageRecord;
import com.powerwatch.backup.etl.failure.FailureReason;
import com.powerwatch.backup.etl.failure.FailureRecord;
import com.powerwatch.backup.etl.failure.FailureReporter;
import com.powerwatch.backup.etl.normalize.SiteIdentifierResolver;
import com.powerwatch.backup.etl.source.TabularRow;
import com.powerwatch.backup.etl.source.TabularSourceReader;
import com.powerwatch.backup.etl.source.TabularTable;
import com.powerwatch.backup.etl.source.TimestampParser;
import com.powerwatch.backup.exception.SchemaMismatchException;
import com.powerwatch.backup.exception.SourceUnreadableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produces outage records from the site-unavailability export (CSV, TSV or workbook).
 *
 * Expected columns: {@code Occurred On (NT)}, {@code Cleared On (NT)}, {@code MO Name}, {@code Name}.
 * The table has no sheets to fall back on, so a missing column fails the whole source.
 */
public class OutageIngestor extends AbstractIngestor {
    private static final Logger log = LoggerFactory.getLogger(OutageIngestor.class);

    static final String MO_NAME = "MO Name";

    private static final List<String> REQUIRED_COLUMNS = List.of(OCCURRED_ON, CLEARED_ON, MO_NAME, NAME);

    public OutageIngestor(String runId, FailureReporter failureReporter) {
        this(runId, failureReporter, new TabularSourceReader(), new SiteIdentifierResolver(), new TimestampParser());
    }

    public OutageIngestor(String runId, FailureReporter failureReporter, TabularSourceReader sourceReader,
                          SiteIdentifierResolver siteResolver, TimestampParser timestampParser) {
        super(runId, failureReporter, sourceReader, siteResolver, timestampParser);
    }

    @Override
    protected FailureRecord.SourceType sourceType() {
        return FailureRecord.SourceType.OUTAGE_TABLE;
    }

    /**
     * @return outages in file order, or empty if the file is unreadable or lacks a required column
     */
    public Optional<List<OutageRecord>> ingest(Path file) {
        log.info("Processing outage file: {}", file);

        TabularTable table;
        try {
            table = sourceReader.readSingleTable(file);
            table.requireColumns(REQUIRED_COLUMNS);
        } catch (SourceUnreadableException e) {
            log.error("Error reading outage file {}", file, e);
            reportSourceFailure(file, FailureReason.FILE_READ_ERROR, e.getMessage());
            return Optional.empty();
        } catch (SchemaMismatchException e) {
            log.error("Outage file {} is missing columns {}", file, e.getMissingColumns());
            reportSourceFailure(file, FailureReason.SCHEMA_MISMATCH, e.getMessage());
            return Optional.empty();
        }

        int occurredIdx = table.columnIndex(OCCURRED_ON);
        int clearedIdx = table.columnIndex(CLEARED_ON);
        int moIdx = table.columnIndex(MO_NAME);
        int nameIdx = table.columnIndex(NAME);

        List<OutageRecord> outages = new ArrayList<>(table.rows().size());
        for (TabularRow row : table.rows()) {
            LocalDateTime occurredAt = timestamp(file, null, row, occurredIdx, OCCURRED_ON);
            LocalDateTime clearedAt = timestamp(file, null, row, clearedIdx, CLEARED_ON);
            String moLabel = normalizedText(row, moIdx);
            String outageName = normalizedText(row, nameIdx);
            outages.add(new OutageRecord(occurredAt, clearedAt, moLabel, outageName, resolveSite(moLabel)));
        }

        log.info("Outage file {} processed with {} records", file, outages.size());
        return Optional.of(outages);
    }
}

package com.powerwatch.backup.etl.ingest;

import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.etl.failure.FailureReason;
import com.powerwatch.backup.etl.failure.FailureRecord;
import com.powerwatch.backup.etl.failure.FailureReporter;
import com.powerwatch.backup.etl.normalize.SiteIdentifierResolver;
import com.powerwatch.backup.etl.normalize.TextNormalizer;
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
 * Produces alarm records from the regional alarm workbook, one sheet per region.
 *
 * Expected sheet columns: {@code Occurred On (NT)}, {@code Cleared On (NT)}, {@code Alarm Source},
 * {@code Name}. One region exports {@code Last Occurred (NT)} in place of the occurrence column; for the
 * sheet named by {@code alternateOccurrenceSheet} that column is renamed before validation.
 *
 * Sheets missing a required column are skipped. The workbook yields no result when it cannot be
 * opened or when no sheet survives validation.
 */
public class AlarmIngestor extends AbstractIngestor {
    private static final Logger log = LoggerFactory.getLogger(AlarmIngestor.class);

    static final String ALARM_SOURCE = "Alarm Source";
    static final String LAST_OCCURRED = "Last Occurred (NT)";
    public static final String DEFAULT_ALTERNATE_OCCURRENCE_SHEET = "PENINSULA";

    private static final List<String> REQUIRED_COLUMNS = List.of(OCCURRED_ON, CLEARED_ON, ALARM_SOURCE, NAME);

    private final String alternateOccurrenceSheet;

    public AlarmIngestor(String runId, FailureReporter failureReporter) {
        this(runId, failureReporter, new TabularSourceReader(), new SiteIdentifierResolver(), new TimestampParser(),
            DEFAULT_ALTERNATE_OCCURRENCE_SHEET);
    }

    public AlarmIngestor(String runId, FailureReporter failureReporter, TabularSourceReader sourceReader,
                         SiteIdentifierResolver siteResolver, TimestampParser timestampParser,
                         String alternateOccurrenceSheet) {
        super(runId, failureReporter, sourceReader, siteResolver, timestampParser);
        this.alternateOccurrenceSheet = alternateOccurrenceSheet;
    }

    @Override
    protected FailureRecord.SourceType sourceType() {
        return FailureRecord.SourceType.ALARM_WORKBOOK;
    }

    /**
     * @return alarms of every valid sheet in sheet order then row order, or empty if the workbook is
     *         unreadable or has no valid sheet
     */
    public Optional<List<AlarmRecord>> ingest(Path workbook) {
        log.info("Processing alarm workbook: {}", workbook);

        List<TabularTable> sheets;
        try {
            sheets = sourceReader.readAllSheets(workbook);
        } catch (SourceUnreadableException e) {
            log.error("Error reading alarm workbook {}", workbook, e);
            reportSourceFailure(workbook, FailureReason.FILE_READ_ERROR, e.getMessage());
            return Optional.empty();
        }

        List<AlarmRecord> alarms = new ArrayList<>();
        int validSheets = 0;
        for (TabularTable sheet : sheets) {
            TabularTable harmonized = harmonize(sheet);
            try {
                harmonized.requireColumns(REQUIRED_COLUMNS);
            } catch (SchemaMismatchException e) {
                log.warn("Sheet '{}' of {} is missing columns {}, skipping it", sheet.name(), workbook, e.getMissingColumns());
                failureReporter.recordFailure(FailureRecord.forSheet(
                    runId, sourceType(), workbook.toString(), sheet.name(), FailureReason.SCHEMA_MISMATCH, e.getMessage()
                ));
                continue;
            }
            List<AlarmRecord> sheetAlarms = ingestSheet(workbook, harmonized);
            log.info("Sheet '{}' produced {} alarm records", sheet.name(), sheetAlarms.size());
            alarms.addAll(sheetAlarms);
            validSheets++;
        }

        if (validSheets == 0) {
            log.error("No sheet of {} contained the expected columns {}", workbook, REQUIRED_COLUMNS);
            reportSourceFailure(workbook, FailureReason.NO_VALID_SHEETS,
                sheets.size() + " sheet(s) read, none had columns " + REQUIRED_COLUMNS);
            return Optional.empty();
        }

        log.info("Alarm workbook {} processed: {} records from {} of {} sheets", workbook, alarms.size(), validSheets, sheets.size());
        return Optional.of(alarms);
    }

    TabularTable harmonize(TabularTable sheet) {
        if (sheet.name().equalsIgnoreCase(alternateOccurrenceSheet) && !sheet.hasColumn(OCCURRED_ON) && sheet.hasColumn(LAST_OCCURRED)) {
            log.info("Sheet '{}' uses '{}', renaming it to '{}'", sheet.name(), LAST_OCCURRED, OCCURRED_ON);
            return sheet.renameColumn(LAST_OCCURRED, OCCURRED_ON);
        }
        return sheet;
    }

    private List<AlarmRecord> ingestSheet(Path workbook, TabularTable sheet) {
        int occurredIdx = sheet.columnIndex(OCCURRED_ON);
        int clearedIdx = sheet.columnIndex(CLEARED_ON);
        int sourceIdx = sheet.columnIndex(ALARM_SOURCE);
        int nameIdx = sheet.columnIndex(NAME);
        String region = TextNormalizer.normalize(sheet.name());

        List<AlarmRecord> records = new ArrayList<>(sheet.rows().size());
        for (TabularRow row : sheet.rows()) {
            LocalDateTime occurredAt = timestamp(workbook, sheet.name(), row, occurredIdx, OCCURRED_ON);
            LocalDateTime clearedAt = timestamp(workbook, sheet.name(), row, clearedIdx, CLEARED_ON);
            String source = normalizedText(row, sourceIdx);
            String name = normalizedText(row, nameIdx);
            records.add(new AlarmRecord(occurredAt, clearedAt, source, name, region, resolveSite(source)));
        }
        return records;
    }
}

package com.powerwatch.backup.etl.ingest;

import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.etl.failure.CapturingFailureReporter;
import com.powerwatch.backup.etl.failure.FailureReason;
import com.powerwatch.backup.etl.failure.FailureRecord;
import com.powerwatch.backup.etl.source.WorkbookFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static com.powerwatch.backup.etl.source.WorkbookFixtures.row;
import static org.junit.jupiter.api.Assertions.*;

class AlarmIngestorTest {

    private static final String RUN_ID = "run-1";

    @TempDir
    Path dir;

    private CapturingFailureReporter failures;
    private AlarmIngestor ingestor;

    @BeforeEach
    void setUp() {
        failures = new CapturingFailureReporter();
        ingestor = new AlarmIngestor(RUN_ID, failures);
    }

    @Test
    void shouldIngestValidSheetsAndSkipSheetMissingName() throws Exception {
        Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
        sheets.put("Norte", List.of(
            row("Occurred On (NT)", "Cleared On (NT)", "Alarm Source", "Name"),
            row("03/01/2025 10:00", "03/01/2025 12:00", "NodeB Name=TAMREY1591, LogicRNCID=141", "Minor Rect Failure"),
            row("not a date", "-", "YUC-YAX0519", "Major Rect Failure")
        ));
        sheets.put("BROKEN", List.of(
            row("Occurred On (NT)", "Cleared On (NT)", "Alarm Source"),
            row("03/01/2025 10:00", "03/01/2025 12:00", "SITE1")
        ));
        sheets.put("Peninsula", List.of(
            row("Last Occurred (NT)", "Cleared On (NT)", "Alarm Source", "Name"),
            row(LocalDateTime.of(2025, 1, 4, 8, 0), null, "NODEB NAMEMERPEN0101 LOGICRNCID7", "MINOR RECT FAILURE")
        ));
        Path workbook = WorkbookFixtures.write(dir.resolve("alarms.xlsx"), sheets);

        Optional<List<AlarmRecord>> result = ingestor.ingest(workbook);

        assertTrue(result.isPresent());
        List<AlarmRecord> alarms = result.get();
        assertEquals(List.of(
            new AlarmRecord(LocalDateTime.of(2025, 1, 3, 10, 0), LocalDateTime.of(2025, 1, 3, 12, 0),
                "NODEB NAMETAMREY1591 LOGICRNCID141", "MINOR RECT FAILURE", "NORTE", "TAMREY1591"),
            new AlarmRecord(null, null, "YUCYAX0519", "MAJOR RECT FAILURE", "NORTE", "YUCYAX0519"),
            new AlarmRecord(LocalDateTime.of(2025, 1, 4, 8, 0), null,
                "NODEB NAMEMERPEN0101 LOGICRNCID7", "MINOR RECT FAILURE", "PENINSULA", "MERPEN0101")
        ), alarms);

        assertEquals(List.of(FailureReason.INVALID_TIMESTAMP, FailureReason.SCHEMA_MISMATCH), failures.getReasons());
        FailureRecord badTime = failures.getRecords().get(0);
        assertEquals(RUN_ID, badTime.runId());
        assertEquals("Norte", badTime.sheet());
        assertEquals(3, badTime.rowNumber());
        assertEquals("Occurred On (NT)", badTime.column());
        assertEquals("not a date", badTime.valueRaw());
        FailureRecord skipped = failures.getRecords().get(1);
        assertEquals("BROKEN", skipped.sheet());
        assertTrue(skipped.reasonDetail().contains("Name"));
    }

    @Test
    void shouldReportNoResultWhenEverySheetIsInvalid() throws Exception {
        Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
        sheets.put("A", List.of(row("Alarm Source", "Name"), row("SITE1", "MINOR RECT FAILURE")));
        sheets.put("B", List.of(row("Something else")));
        Path workbook = WorkbookFixtures.write(dir.resolve("alarms.xlsx"), sheets);

        assertEquals(Optional.empty(), ingestor.ingest(workbook));
        assertEquals(List.of(FailureReason.SCHEMA_MISMATCH, FailureReason.SCHEMA_MISMATCH, FailureReason.NO_VALID_SHEETS),
            failures.getReasons());
        assertEquals(FailureRecord.SourceType.ALARM_WORKBOOK, failures.getRecords().get(2).sourceType());
    }

    @Test
    void shouldReportNoResultWhenWorkbookIsMissing() {
        Path missing = dir.resolve("missing.xlsx");

        assertEquals(Optional.empty(), ingestor.ingest(missing));
        assertEquals(List.of(FailureReason.FILE_READ_ERROR), failures.getReasons());
        assertEquals(missing.toString(), failures.getRecords().get(0).inputFile());
    }

    @Test
    void shouldReportNoResultWhenWorkbookHasNoWorkbookPart() throws Exception {
        Path stub = dir.resolve("alarms.xlsx");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(stub))) {
            zip.putNextEntry(new ZipEntry("[Content_Types].xml"));
            zip.write("<Types/>".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }

        assertEquals(Optional.empty(), ingestor.ingest(stub));
        assertEquals(List.of(FailureReason.FILE_READ_ERROR), failures.getReasons());
    }

    @Test
    void shouldOnlyHarmonizeTheAlternateSheet() throws Exception {
        Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
        sheets.put("CENTRO", List.of(
            row("Last Occurred (NT)", "Cleared On (NT)", "Alarm Source", "Name"),
            row("03/01/2025 10:00", null, "SITE1", "MINOR RECT FAILURE")
        ));
        sheets.put("PENINSULA", List.of(
            row("Occurred On (NT)", "Last Occurred (NT)", "Cleared On (NT)", "Alarm Source", "Name"),
            row("05/01/2025 10:00", "06/01/2025 10:00", null, "SITE2", "MINOR RECT FAILURE")
        ));
        Path workbook = WorkbookFixtures.write(dir.resolve("alarms.xlsx"), sheets);

        List<AlarmRecord> alarms = ingestor.ingest(workbook).orElseThrow();

        assertEquals(1, alarms.size());
        assertEquals("PENINSULA", alarms.get(0).region());
        assertEquals(LocalDateTime.of(2025, 1, 5, 10, 0), alarms.get(0).occurredAt(), "canonical column wins when both exist");
        assertEquals(List.of(FailureReason.SCHEMA_MISMATCH), failures.getReasons());
        assertEquals("CENTRO", failures.getRecords().get(0).sheet());
    }
}

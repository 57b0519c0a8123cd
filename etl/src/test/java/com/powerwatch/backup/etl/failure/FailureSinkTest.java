package com.powerwatch.backup.etl.failure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FailureSinkTest {

    @Test
    void shouldWriteOneJsonLinePerFailureAndRollup(@TempDir Path dir, @Mock FailureReporter delegate) throws Exception {
        Path out = dir.resolve("failures.jsonl");
        FailureRecord badTime = new FailureRecord("run-1", FailureRecord.SourceType.OUTAGE_TABLE, "outages.csv", null,
            4, "Occurred On (NT)", "32/01/2025", FailureReason.INVALID_TIMESTAMP, "no format matched");
        FailureRecord badSheet = FailureRecord.forSheet("run-1", FailureRecord.SourceType.ALARM_WORKBOOK, "alarms.xlsx",
            "SUR", FailureReason.SCHEMA_MISMATCH, "missing Name");

        try (FailureSink sink = new FailureSink(out, delegate)) {
            sink.recordFailure(badTime);
            sink.recordFailure(badSheet);
            sink.recordFailure(badTime);
            assertEquals(3, sink.getTotalFailures());
        }

        verify(delegate, times(2)).recordFailure(badTime);
        verify(delegate).recordFailure(badSheet);

        List<String> lines = Files.readAllLines(out);
        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        assertEquals("INVALID_TIMESTAMP", first.get("reasonCode").asText());
        assertEquals(4, first.get("rowNumber").asInt());
        assertFalse(first.has("sheet"), "null fields are omitted");
        JsonNode second = new ObjectMapper().readTree(lines.get(1));
        assertEquals("SUR", second.get("sheet").asText());
        assertFalse(second.has("rowNumber"));

        assertTrue(lines.contains("--- ROLLUP SUMMARY ---"));
        assertTrue(lines.contains("Source: outages.csv"));
        assertTrue(lines.contains("  INVALID_TIMESTAMP: 2"));
        assertTrue(lines.contains("Total Failures: 3"));
    }

    @Test
    void loggingReporterShouldCount() {
        LoggingFailureReporter reporter = new LoggingFailureReporter();
        reporter.recordFailure(FailureRecord.forSource("run-1", FailureRecord.SourceType.STORE, "alarms",
            FailureReason.PERSISTENCE_ERROR, "disk full"));
        assertEquals(1, reporter.getTotalFailures());
    }
}

package com.powerwatch.backup.processing.io;

import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.data.record.JoinedRecord;
import com.powerwatch.backup.data.record.OutageRecord;
import com.powerwatch.backup.data.schema.EntityKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JoinedCsvExporterTest {

    @Captor
    private ArgumentCaptor<Collection<String[]>> rows;

    private static JoinedRecord sample() {
        AlarmRecord alarm = new AlarmRecord(LocalDateTime.of(2025, 1, 3, 10, 0), null, "SRC", "MINOR RECT FAILURE", "NORTE", "S1");
        OutageRecord outage = new OutageRecord(LocalDateTime.of(2025, 1, 3, 12, 30), null, "MO", "DOWN", "S1");
        return JoinedRecord.of(alarm, outage);
    }

    @Test
    void shouldWriteHeaderAndRowsToCsv(@TempDir Path dir) throws Exception {
        Path csv = new JoinedCsvExporter().export(List.of(sample()), dir.resolve("resultados_joined.csv"));

        List<String> lines = Files.readAllLines(csv);
        assertEquals(2, lines.size());
        assertEquals(String.join(",", EntityKind.JOINED.getColumns()), lines.get(0));
        assertEquals("2025-01-03 10:00:00,,SRC,MINOR RECT FAILURE,NORTE,S1,2025-01-03 12:30:00,,MO,DOWN,S1,PT2H30M,150.0",
            lines.get(1));
    }

    @Test
    void shouldWriteHeaderOnlyForEmptyTable(@TempDir Path dir) throws Exception {
        Path csv = new JoinedCsvExporter().export(List.of(), dir.resolve("empty.csv"));

        assertEquals(List.of(String.join(",", EntityKind.JOINED.getColumns())), Files.readAllLines(csv));
    }

    @Test
    void shouldCloseWriterAfterExport(@Mock ResultWriter writer) {
        Path destination = Path.of("out.csv");

        new JoinedCsvExporter(path -> writer).export(List.of(sample()), destination);

        verify(writer).writeHeader(any(String[].class));
        verify(writer).writeRows(rows.capture());
        verify(writer).close();
        assertEquals(1, rows.getValue().size());
        assertEquals("", rows.getValue().iterator().next()[1]);
    }
}

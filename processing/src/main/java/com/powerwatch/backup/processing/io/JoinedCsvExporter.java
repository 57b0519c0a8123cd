package com.powerwatch.backup.processing.io;

import com.powerwatch.backup.data.record.JoinedRecord;
import com.powerwatch.backup.data.schema.EntityKind;
import com.powerwatch.backup.data.schema.StoredValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Dumps the joined table to CSV with the stored column names as header. Null values become empty cells.
 */
public class JoinedCsvExporter {
    private static final Logger log = LoggerFactory.getLogger(JoinedCsvExporter.class);

    private final Function<Path, ResultWriter> writerFactory;

    public JoinedCsvExporter() {
        this(CsvWriter::new);
    }

    public JoinedCsvExporter(Function<Path, ResultWriter> writerFactory) {
        this.writerFactory = writerFactory;
    }

    public Path export(List<JoinedRecord> joined, Path destination) {
        List<String> columns = EntityKind.JOINED.getColumns();
        List<String[]> rows = new ArrayList<>(joined.size());
        for (JoinedRecord record : joined) {
            rows.add(toCells(StoredValues.joinedValues(record)));
        }
        try (ResultWriter writer = writerFactory.apply(destination)) {
            writer.writeHeader(columns.toArray(new String[0]));
            writer.writeRows(rows);
        }
        log.info("Exported {} joined rows to {}", rows.size(), destination);
        return destination;
    }

    static String[] toCells(List<Object> values) {
        String[] cells = new String[values.size()];
        for (int i = 0; i < cells.length; i++) {
            Object value = values.get(i);
            cells[i] = value == null ? "" : value.toString();
        }
        return cells;
    }
}

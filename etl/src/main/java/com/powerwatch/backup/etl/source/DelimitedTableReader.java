package com.powerwatch.backup.etl.source;

import com.google.common.base.Strings;
import com.powerwatch.backup.exception.SourceUnreadableException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads a delimited text file whose first record is the header. Empty fields become null.
 * A leading byte order mark is skipped.
 */
public class DelimitedTableReader {
    private static final Logger log = LoggerFactory.getLogger(DelimitedTableReader.class);

    public TabularTable read(Path path, char delimiter) throws SourceUnreadableException {
        if (!Files.isRegularFile(path)) {
            throw new SourceUnreadableException(path, "Delimited file not found: " + path);
        }
        log.info("Reading delimited file {} (delimiter '{}')", path, delimiter == '\t' ? "\\t" : delimiter);

        CSVFormat format = CSVFormat.DEFAULT
            .builder()
            .setDelimiter(delimiter)
            .setIgnoreEmptyLines(true)
            .setQuote('"')
            .build();

        try (Reader reader = new InputStreamReader(BOMInputStream.builder().setPath(path).get(), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                log.warn("Delimited file {} is empty", path);
                return new TabularTable(path.getFileName().toString(), List.of(), List.of());
            }

            CSVRecord headerRecord = records.next();
            List<String> header = new ArrayList<>(headerRecord.size());
            headerRecord.forEach(header::add);

            List<TabularRow> rows = new ArrayList<>();
            int rowNumber = 1;
            while (records.hasNext()) {
                CSVRecord record = records.next();
                rowNumber++;
                List<Object> values = new ArrayList<>(header.size());
                for (int i = 0; i < header.size(); i++) {
                    values.add(i < record.size() ? Strings.emptyToNull(record.get(i)) : null);
                }
                rows.add(new TabularRow(rowNumber, values));
            }
            return new TabularTable(path.getFileName().toString(), header, rows);
        } catch (IOException | UncheckedIOException e) {
            throw new SourceUnreadableException(path, "Could not read delimited file " + path + ": " + e.getMessage(), e);
        }
    }
}

package com.powerwatch.backup.processing.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

public class CsvWriter implements ResultWriter {

    private final de.siegmar.fastcsv.writer.CsvWriter csvWriter;

    private final Writer fileWriter;

    private final Path file;

    public CsvWriter(Path file) {
        this.file = file;
        csvWriter = new de.siegmar.fastcsv.writer.CsvWriter();
        try {
            this.fileWriter = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("IOException while opening CSV file : " + file.toAbsolutePath(), e);
        }
    }

    @Override
    public void writeHeader(String[] header) {
        writeRows(List.<String[]>of(header));
    }

    @Override
    public void writeRows(Collection<String[]> rows) {
        try {
            csvWriter.write(fileWriter, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("IOException while appending to CSV file " + file, e);
        }
    }

    @Override
    public void close() {
        try {
            fileWriter.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

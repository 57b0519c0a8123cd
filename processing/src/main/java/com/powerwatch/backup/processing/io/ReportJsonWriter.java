package com.powerwatch.backup.processing.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.powerwatch.backup.processing.report.BackupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

public class ReportJsonWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportJsonWriter.class);

    private final ObjectMapper objectMapper;

    public ReportJsonWriter() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(BackupReport report, Path destination) {
        try {
            objectMapper.writeValue(destination.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write report to " + destination, e);
        }
        log.info("Wrote report to {}", destination);
        return destination;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}

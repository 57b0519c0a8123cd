package com.powerwatch.backup.etl.failure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSONL failure sink. Writes one JSON object per line, and a rollup of failure counts per input
 * file and reason when closed. Every failure is also passed to a delegate reporter for logging.
 */
public class FailureSink implements FailureReporter, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FailureSink.class);

    private final Path outputFile;
    private final BufferedWriter writer;
    private final ObjectMapper mapper;
    private final FailureReporter delegate;

    // input file -> reason -> count
    private final Map<String, Map<FailureReason, Long>> rollupCounters = new TreeMap<>();
    private long totalFailures = 0;

    public FailureSink(Path outputFile) throws IOException {
        this(outputFile, new LoggingFailureReporter());
    }

    public FailureSink(Path outputFile, FailureReporter delegate) throws IOException {
        this.outputFile = outputFile;
        this.delegate = delegate;
        this.writer = Files.newBufferedWriter(outputFile,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);

        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        log.info("Initialized failure sink: {}", outputFile);
    }

    @Override
    public void recordFailure(FailureRecord record) {
        delegate.recordFailure(record);
        try {
            writer.write(mapper.writeValueAsString(record));
            writer.newLine();
        } catch (IOException e) {
            log.error("Failed to write failure record to {}", outputFile, e);
        }

        String source = record.inputFile() == null ? "(none)" : record.inputFile();
        rollupCounters
            .computeIfAbsent(source, k -> new EnumMap<>(FailureReason.class))
            .merge(record.reasonCode(), 1L, Long::sum);
        totalFailures++;
    }

    /**
     * Writes rollup summary at end of run.
     */
    public void writeRollup() throws IOException {
        writer.write("\n--- ROLLUP SUMMARY ---\n");

        for (Map.Entry<String, Map<FailureReason, Long>> sourceEntry : rollupCounters.entrySet()) {
            writer.write(String.format("Source: %s%n", sourceEntry.getKey()));
            for (Map.Entry<FailureReason, Long> reasonEntry : sourceEntry.getValue().entrySet()) {
                writer.write(String.format("  %s: %d%n", reasonEntry.getKey(), reasonEntry.getValue()));
            }
        }

        writer.write(String.format("Total Failures: %d%n", totalFailures));
        writer.flush();

        log.info("Wrote rollup summary: {} total failures", totalFailures);
    }

    @Override
    public long getTotalFailures() {
        return totalFailures;
    }

    @Override
    public void close() throws IOException {
        writeRollup();
        writer.close();
        log.info("Closed failure sink: {}", outputFile);
    }
}

package com.powerwatch.backup.ingest.input;

import com.powerwatch.backup.ingest.config.IngestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;

/**
 * Resolves the configured file names against the input directory. Existence is only logged; the
 * ingestors report unreadable files.
 */
public class ConfiguredInputLocator implements InputLocator {
    private static final Logger log = LoggerFactory.getLogger(ConfiguredInputLocator.class);

    private final IngestConfig config;

    public ConfiguredInputLocator(IngestConfig config) {
        this.config = config;
    }

    @Override
    public InputFiles locate() {
        InputFiles files = new InputFiles(config.getAlarmsPath(), config.getOutagesPath());
        if (!Files.isRegularFile(files.alarmsWorkbook())) {
            log.warn("Alarm workbook not found at {}", files.alarmsWorkbook());
        }
        if (!Files.isRegularFile(files.outageTable())) {
            log.warn("Outage table not found at {}", files.outageTable());
        }
        return files;
    }
}

package com.powerwatch.backup.ingest.input;

import com.powerwatch.backup.ingest.config.IngestConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredInputLocatorTest {

    @Test
    void shouldResolveConfiguredNamesAgainstInputDir(@TempDir Path dir) {
        IngestConfig config = new IngestConfig();
        config.setInputDir(dir.toString());
        config.setOutagesFile("nodeb_unavailable.xlsx");

        InputLocator.InputFiles files = new ConfiguredInputLocator(config).locate();

        assertEquals(dir.resolve("LOGS DE AE SEMANA 01-2025.xlsx"), files.alarmsWorkbook());
        assertEquals(dir.resolve("nodeb_unavailable.xlsx"), files.outageTable());
    }
}

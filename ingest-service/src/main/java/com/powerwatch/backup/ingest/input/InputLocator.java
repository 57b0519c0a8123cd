package com.powerwatch.backup.ingest.input;

import java.nio.file.Path;

/**
 * Finds the files a run reads. The mailbox fetcher that drops attachments on disk sits behind this seam.
 */
public interface InputLocator {

    record InputFiles(Path alarmsWorkbook, Path outageTable) {}

    InputFiles locate();
}

package com.powerwatch.backup.ingest;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Outcome of one pipeline run. Counts are those read back from the store after saving.
 */
public record RunSummary(
    String runId,
    boolean success,
    int alarmCount,
    int outageCount,
    int joinedCount,
    long failureCount,
    Duration elapsed,
    @Nullable String failureMessage
) {
    public static RunSummary failed(String runId, long failureCount, Duration elapsed, String failureMessage) {
        return new RunSummary(runId, false, 0, 0, 0, failureCount, elapsed, failureMessage);
    }

    public int exitCode() {
        return success ? 0 : 1;
    }
}

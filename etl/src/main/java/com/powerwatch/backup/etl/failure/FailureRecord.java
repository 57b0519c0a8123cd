package com.powerwatch.backup.etl.failure;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSONL record for failure capture.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureRecord(
    String runId,
    SourceType sourceType,
    String inputFile,
    String sheet,        // null for single-table sources
    Integer rowNumber,   // 1-based, header is row 1
    String column,
    String valueRaw,
    FailureReason reasonCode,
    String reasonDetail
) {
    public enum SourceType {
        ALARM_WORKBOOK,
        OUTAGE_TABLE,
        STORE,
        EXPORT
    }

    public static FailureRecord forSource(String runId, SourceType sourceType, String inputFile,
                                          FailureReason reason, String detail) {
        return new FailureRecord(runId, sourceType, inputFile, null, null, null, null, reason, detail);
    }

    public static FailureRecord forSheet(String runId, SourceType sourceType, String inputFile, String sheet,
                                         FailureReason reason, String detail) {
        return new FailureRecord(runId, sourceType, inputFile, sheet, null, null, null, reason, detail);
    }
}

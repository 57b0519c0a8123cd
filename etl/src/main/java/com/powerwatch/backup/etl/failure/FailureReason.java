package com.powerwatch.backup.etl.failure;

/**
 * Stable enumeration of failure reasons written to the failure log.
 */
public enum FailureReason {
    FILE_READ_ERROR("Unable to read source file"),
    SCHEMA_MISMATCH("Required columns missing"),
    NO_VALID_SHEETS("No sheet of the workbook had the required columns"),
    INVALID_TIMESTAMP("Timestamp unparseable"),
    PERSISTENCE_ERROR("Replacing stored rows failed"),
    EXPORT_ERROR("Writing an export file failed");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}

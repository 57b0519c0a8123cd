package com.powerwatch.backup.processing.report;

public record SiteBackupAverage(String siteId, double averageMinutes, int joinedRows) {
}

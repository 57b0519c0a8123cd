package com.powerwatch.backup.processing.report;

public record AlarmNameCount(String alarmName, long count) {
}

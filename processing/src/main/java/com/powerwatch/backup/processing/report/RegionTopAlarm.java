package com.powerwatch.backup.processing.report;

public record RegionTopAlarm(String region, String alarmName, long count) {
}

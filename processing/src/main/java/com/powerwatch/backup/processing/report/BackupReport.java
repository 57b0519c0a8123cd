package com.powerwatch.backup.processing.report;

import java.util.List;

/**
 * Aggregates handed to the presentation layer. Lists are immutable and in a deterministic order.
 *
 * @param averageBackupBySite   mean backup minutes per alarm site, ordered by site id
 * @param topAlarmNames         most frequent alarm names, count descending then name ascending
 * @param targetAlarmSiteCount  distinct sites that raised the target alarm class
 * @param topAlarmByRegion      most frequent alarm name per region, ordered by region
 */
public record BackupReport(
    String targetAlarmClass,
    List<SiteBackupAverage> averageBackupBySite,
    List<AlarmNameCount> topAlarmNames,
    long targetAlarmSiteCount,
    List<RegionTopAlarm> topAlarmByRegion
) {
    public BackupReport {
        averageBackupBySite = List.copyOf(averageBackupBySite);
        topAlarmNames = List.copyOf(topAlarmNames);
        topAlarmByRegion = List.copyOf(topAlarmByRegion);
    }
}

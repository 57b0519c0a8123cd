package com.powerwatch.backup.processing.report;

import com.google.common.base.Preconditions;
import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.data.record.JoinedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only summaries over the persisted alarm and joined sets.
 *
 * Name rankings order by count descending and break ties by alarm name ascending, so the same
 * input always produces the same report.
 */
public class ReportingAggregator {
    private static final Logger log = LoggerFactory.getLogger(ReportingAggregator.class);

    static final Comparator<AlarmNameCount> BY_COUNT_THEN_NAME =
        Comparator.comparingLong(AlarmNameCount::count).reversed()
            .thenComparing(AlarmNameCount::alarmName);

    private final String targetAlarmClass;

    public ReportingAggregator(String targetAlarmClass) {
        this.targetAlarmClass = targetAlarmClass;
    }

    public BackupReport summarize(List<AlarmRecord> alarms, List<JoinedRecord> joined, int topN) {
        Preconditions.checkArgument(topN >= 0, "topN must not be negative: %s", topN);
        BackupReport report = new BackupReport(
            targetAlarmClass,
            averageBackupBySite(joined),
            topAlarmNames(alarms, topN),
            targetAlarmSiteCount(alarms),
            topAlarmByRegion(alarms)
        );
        log.info("Report built: {} sites with backup averages, {} top alarm names, {} sites with '{}', {} regions",
            report.averageBackupBySite().size(), report.topAlarmNames().size(), report.targetAlarmSiteCount(),
            targetAlarmClass, report.topAlarmByRegion().size());
        return report;
    }

    public List<SiteBackupAverage> averageBackupBySite(List<JoinedRecord> joined) {
        Map<String, double[]> sums = new TreeMap<>();
        for (JoinedRecord row : joined) {
            double[] acc = sums.computeIfAbsent(row.alarm().resolvedSiteId(), k -> new double[2]);
            acc[0] += row.backupMinutes();
            acc[1]++;
        }
        List<SiteBackupAverage> averages = new ArrayList<>(sums.size());
        sums.forEach((site, acc) -> averages.add(new SiteBackupAverage(site, acc[0] / acc[1], (int) acc[1])));
        return averages;
    }

    public List<AlarmNameCount> topAlarmNames(List<AlarmRecord> alarms, int topN) {
        return rank(countByName(alarms)).stream().limit(topN).toList();
    }

    public long targetAlarmSiteCount(List<AlarmRecord> alarms) {
        return alarms.stream()
            .filter(a -> a.nameContains(targetAlarmClass))
            .map(AlarmRecord::resolvedSiteId)
            .distinct()
            .count();
    }

    public List<RegionTopAlarm> topAlarmByRegion(List<AlarmRecord> alarms) {
        Map<String, List<AlarmRecord>> byRegion = new TreeMap<>();
        for (AlarmRecord alarm : alarms) {
            byRegion.computeIfAbsent(alarm.region(), k -> new ArrayList<>()).add(alarm);
        }
        List<RegionTopAlarm> result = new ArrayList<>(byRegion.size());
        byRegion.forEach((region, regionAlarms) -> {
            AlarmNameCount top = rank(countByName(regionAlarms)).get(0);
            result.add(new RegionTopAlarm(region, top.alarmName(), top.count()));
        });
        return result;
    }

    private static Map<String, Long> countByName(List<AlarmRecord> alarms) {
        Map<String, Long> counts = new HashMap<>();
        for (AlarmRecord alarm : alarms) {
            counts.merge(alarm.alarmName(), 1L, Long::sum);
        }
        return counts;
    }

    private static List<AlarmNameCount> rank(Map<String, Long> counts) {
        List<AlarmNameCount> ranked = new ArrayList<>(counts.size());
        counts.forEach((name, count) -> ranked.add(new AlarmNameCount(name, count)));
        ranked.sort(BY_COUNT_THEN_NAME);
        return ranked;
    }
}

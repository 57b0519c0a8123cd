package com.powerwatch.backup.processing.join;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.data.record.JoinedRecord;
import com.powerwatch.backup.data.record.OutageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs every alarm of the target class with every outage at the same resolved site that occurred
 * no earlier than the alarm. All qualifying pairs are kept; there is no nearest-match selection.
 */
public class TemporalJoinEngine {
    private static final Logger log = LoggerFactory.getLogger(TemporalJoinEngine.class);

    public static final String DEFAULT_TARGET_ALARM_CLASS = "MINOR RECT FAILURE";

    private final String targetAlarmClass;

    public TemporalJoinEngine() {
        this(DEFAULT_TARGET_ALARM_CLASS);
    }

    /**
     * @param targetAlarmClass substring the normalized alarm name must contain
     */
    public TemporalJoinEngine(String targetAlarmClass) {
        Preconditions.checkArgument(targetAlarmClass != null && !targetAlarmClass.isBlank(),
            "Target alarm class must not be blank");
        this.targetAlarmClass = targetAlarmClass;
    }

    public List<JoinedRecord> join(List<AlarmRecord> alarms, List<OutageRecord> outages) {
        ListMultimap<String, OutageRecord> outagesBySite = ArrayListMultimap.create();
        for (OutageRecord outage : outages) {
            outagesBySite.put(outage.resolvedSiteId(), outage);
        }

        List<JoinedRecord> joined = new ArrayList<>();
        int targetAlarms = 0;
        int candidates = 0;
        for (AlarmRecord alarm : alarms) {
            if (!alarm.nameContains(targetAlarmClass)) {
                continue;
            }
            targetAlarms++;
            for (OutageRecord outage : outagesBySite.get(alarm.resolvedSiteId())) {
                candidates++;
                if (isCausal(alarm, outage)) {
                    joined.add(JoinedRecord.of(alarm, outage));
                }
            }
        }

        log.info("Join on '{}': {} of {} alarms matched, {} candidate pairs, {} retained",
            targetAlarmClass, targetAlarms, alarms.size(), candidates, joined.size());
        return joined;
    }

    // a missing time on either side can never satisfy the ordering
    static boolean isCausal(AlarmRecord alarm, OutageRecord outage) {
        return alarm.occurredAt() != null
            && outage.occurredAt() != null
            && !outage.occurredAt().isBefore(alarm.occurredAt());
    }
}

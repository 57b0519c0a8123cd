package com.powerwatch.backup.data.schema;

import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.data.record.JoinedRecord;
import com.powerwatch.backup.data.record.OutageRecord;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Conversion between records and their stored column values, in {@link EntityKind#getColumns()} order.
 * Shared by the database gateway and the CSV export so both dumps carry identical text.
 */
public final class StoredValues {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private StoredValues() {
    }

    public static @Nullable String formatTimestamp(@Nullable LocalDateTime value) {
        return value == null ? null : TIMESTAMP_FORMAT.format(value);
    }

    public static @Nullable LocalDateTime parseTimestamp(@Nullable String value) {
        return value == null ? null : LocalDateTime.parse(value, TIMESTAMP_FORMAT);
    }

    public static String formatDuration(Duration value) {
        return value.toString();
    }

    public static Duration parseDuration(String value) {
        return Duration.parse(value);
    }

    public static List<Object> alarmValues(AlarmRecord alarm) {
        return Arrays.asList(
            formatTimestamp(alarm.occurredAt()),
            formatTimestamp(alarm.clearedAt()),
            alarm.sourceLabel(),
            alarm.alarmName(),
            alarm.region(),
            alarm.resolvedSiteId()
        );
    }

    public static List<Object> outageValues(OutageRecord outage) {
        return Arrays.asList(
            formatTimestamp(outage.occurredAt()),
            formatTimestamp(outage.clearedAt()),
            outage.moLabel(),
            outage.outageName(),
            outage.resolvedSiteId()
        );
    }

    public static List<Object> joinedValues(JoinedRecord joined) {
        List<Object> values = new ArrayList<>(EntityKind.JOINED.getColumns().size());
        values.addAll(alarmValues(joined.alarm()));
        values.addAll(outageValues(joined.outage()));
        values.add(formatDuration(joined.backupDuration()));
        values.add(joined.backupMinutes());
        return values;
    }

    /**
     * Values of {@code record} for {@code kind}; the record type must match the kind.
     */
    public static List<Object> valuesOf(EntityKind kind, Object record) {
        switch (kind) {
            case ALARMS:
                return alarmValues((AlarmRecord) record);
            case OUTAGES:
                return outageValues((OutageRecord) record);
            case JOINED:
                return joinedValues((JoinedRecord) record);
            default:
                throw new IllegalArgumentException("Unknown entity kind " + kind);
        }
    }
}

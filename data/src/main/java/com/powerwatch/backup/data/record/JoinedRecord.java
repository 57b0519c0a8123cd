package com.powerwatch.backup.data.record;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A rectifier alarm paired with an outage that happened at the same site no earlier than the alarm.
 *
 * The ordering constraint is checked on construction, so every instance (including rows read back
 * from the store) satisfies {@code outage.occurredAt >= alarm.occurredAt}.
 */
public record JoinedRecord(
    AlarmRecord alarm,
    OutageRecord outage,
    Duration backupDuration,
    double backupMinutes
) {
    private static final double SECONDS_PER_MINUTE = 60.0;

    public JoinedRecord {
        Objects.requireNonNull(alarm, "alarm");
        Objects.requireNonNull(outage, "outage");
        Objects.requireNonNull(backupDuration, "backupDuration");
        LocalDateTime alarmAt = alarm.occurredAt();
        LocalDateTime outageAt = outage.occurredAt();
        if (alarmAt == null || outageAt == null) {
            throw new IllegalArgumentException("Joined rows need both occurrence times, got alarm="
                + alarmAt + " outage=" + outageAt);
        }
        if (outageAt.isBefore(alarmAt)) {
            throw new IllegalArgumentException("Outage at " + outageAt + " precedes alarm at " + alarmAt);
        }
    }

    /**
     * Pairs an alarm and an outage, deriving the backup duration from their occurrence times.
     *
     * @throws IllegalArgumentException if either time is missing or the outage precedes the alarm
     */
    public static JoinedRecord of(AlarmRecord alarm, OutageRecord outage) {
        if (alarm.occurredAt() == null || outage.occurredAt() == null) {
            throw new IllegalArgumentException("Joined rows need both occurrence times");
        }
        Duration duration = Duration.between(alarm.occurredAt(), outage.occurredAt());
        return new JoinedRecord(alarm, outage, duration, toMinutes(duration));
    }

    public static double toMinutes(Duration duration) {
        double seconds = duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
        return seconds / SECONDS_PER_MINUTE;
    }
}

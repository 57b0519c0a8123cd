package com.powerwatch.backup.data.record;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class JoinedRecordTest {

    private static final LocalDateTime ALARM_AT = LocalDateTime.of(2025, 1, 3, 10, 0);

    private static AlarmRecord alarm(LocalDateTime at) {
        return new AlarmRecord(at, null, "SITE1", "MINOR RECT FAILURE", "NORTE", "SITE1");
    }

    private static OutageRecord outage(LocalDateTime at) {
        return new OutageRecord(at, null, "SITE1", "NODEB UNAVAILABLE", "SITE1");
    }

    @Test
    void shouldDeriveDurationAndFractionalMinutes() {
        JoinedRecord joined = JoinedRecord.of(alarm(ALARM_AT), outage(ALARM_AT.plusMinutes(150).plusSeconds(30)));

        assertEquals(Duration.ofSeconds(150 * 60 + 30), joined.backupDuration());
        assertEquals(150.5, joined.backupMinutes(), 1e-9);
    }

    @Test
    void shouldAcceptSimultaneousOutage() {
        JoinedRecord joined = JoinedRecord.of(alarm(ALARM_AT), outage(ALARM_AT));

        assertEquals(Duration.ZERO, joined.backupDuration());
        assertEquals(0.0, joined.backupMinutes());
    }

    @Test
    void shouldRejectOutageBeforeAlarm() {
        assertThrows(IllegalArgumentException.class, () -> JoinedRecord.of(alarm(ALARM_AT), outage(ALARM_AT.minusSeconds(1))));
    }

    @Test
    void shouldRejectMissingTimes() {
        assertThrows(IllegalArgumentException.class, () -> JoinedRecord.of(alarm(null), outage(ALARM_AT)));
        assertThrows(IllegalArgumentException.class, () -> JoinedRecord.of(alarm(ALARM_AT), outage(null)));
        assertThrows(IllegalArgumentException.class,
            () -> new JoinedRecord(alarm(ALARM_AT), outage(null), Duration.ZERO, 0.0));
    }

    @Test
    void shouldConvertSubSecondDurations() {
        assertEquals(0.5 / 60.0, JoinedRecord.toMinutes(Duration.ofMillis(500)), 1e-12);
    }
}

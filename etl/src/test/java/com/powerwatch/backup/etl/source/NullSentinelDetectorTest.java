package com.powerwatch.backup.etl.source;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class NullSentinelDetectorTest {

    @Test
    void testDefaultNullSentinels() {
        NullSentinelDetector detector = new NullSentinelDetector();

        assertTrue(detector.isNullSentinel(null));
        assertTrue(detector.isNullSentinel(""), "Empty string should be null sentinel");
        assertTrue(detector.isNullSentinel("NaT"), "pandas missing timestamp should be null sentinel");
        assertTrue(detector.isNullSentinel("N/A"), "uppercase N/A should be null sentinel");
        assertTrue(detector.isNullSentinel("-"), "dash placeholder should be null sentinel");
        assertTrue(detector.isNullSentinel("  None "), "None with spaces should be detected");
        assertTrue(detector.isNullSentinel("\\N"), "MySQL null marker should be null sentinel");
    }

    @Test
    void testNonSentinels() {
        NullSentinelDetector detector = new NullSentinelDetector();

        assertFalse(detector.isNullSentinel("03/01/2025 10:00"));
        assertFalse(detector.isNullSentinel("not a date"));
        assertFalse(detector.isNullSentinel(LocalDateTime.of(2025, 1, 3, 10, 0)), "cell values of other types are never sentinels");
        assertFalse(detector.isNullSentinel(0.0));
    }
}

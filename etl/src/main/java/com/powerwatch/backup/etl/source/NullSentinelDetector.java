package com.powerwatch.backup.etl.source;

import java.util.Locale;
import java.util.Set;

/**
 * Detects cell values that stand for "no value" rather than data.
 *
 * <p>Exports from the monitoring platform, and files that passed through spreadsheet tools or
 * dataframe code on the way, write missing cells in several ways: an empty cell, {@code nan},
 * {@code NaT}, {@code None}, {@code null}, {@code N/A}. A timestamp cell holding one of these is
 * treated as absent and is not reported as a parse failure.</p>
 *
 * <p>Matching is case-insensitive and whitespace is trimmed before comparison.</p>
 */
public class NullSentinelDetector {

    private static final Set<String> NULL_SENTINELS = Set.of(
        "",
        "nan",
        "nat",        // pandas missing timestamp
        "na",
        "n/a",
        "null",
        "none",
        "-",
        "\\n"         // MySQL null marker, lowercased
    );

    /**
     * @return true for null and for strings that match a sentinel; false for any other type
     */
    public boolean isNullSentinel(Object value) {
        if (value == null) {
            return true;
        }

        if (value instanceof String str) {
            return NULL_SENTINELS.contains(str.trim().toLowerCase(Locale.ROOT));
        }

        return false;
    }
}

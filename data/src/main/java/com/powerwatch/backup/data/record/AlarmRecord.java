package com.powerwatch.backup.data.record;

import javax.annotation.Nullable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One row of the alarm workbook after harmonization and normalization.
 *
 * Text fields are already normalized; {@code resolvedSiteId} is derived from {@code sourceLabel}
 * and is the key the join matches on.
 */
public record AlarmRecord(
    @Nullable LocalDateTime occurredAt,  // null when the cell could not be parsed
    @Nullable LocalDateTime clearedAt,
    String sourceLabel,
    String alarmName,
    String region,                       // normalized name of the sheet the row came from
    String resolvedSiteId
) {
    public AlarmRecord {
        Objects.requireNonNull(sourceLabel, "sourceLabel");
        Objects.requireNonNull(alarmName, "alarmName");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(resolvedSiteId, "resolvedSiteId");
    }

    public boolean nameContains(String alarmClass) {
        return alarmName.contains(alarmClass);
    }
}

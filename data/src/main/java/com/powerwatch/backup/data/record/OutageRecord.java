package com.powerwatch.backup.data.record;

import javax.annotation.Nullable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One row of the outage table after normalization. {@code resolvedSiteId} is derived from the
 * managed-object label.
 */
public record OutageRecord(
    @Nullable LocalDateTime occurredAt,
    @Nullable LocalDateTime clearedAt,
    String moLabel,
    String outageName,
    String resolvedSiteId
) {
    public OutageRecord {
        Objects.requireNonNull(moLabel, "moLabel");
        Objects.requireNonNull(outageName, "outageName");
        Objects.requireNonNull(resolvedSiteId, "resolvedSiteId");
    }
}

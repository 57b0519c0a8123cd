package com.powerwatch.backup.writer;

import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.data.record.JoinedRecord;
import com.powerwatch.backup.data.record.OutageRecord;
import com.powerwatch.backup.data.schema.EntityKind;

import java.util.List;

/**
 * Durable storage for the three record sets of a run.
 *
 * A save replaces every stored row of its kind. Readers see either the previous complete set or the
 * new complete set, never a mixture.
 */
public interface PersistenceGateway {

    /**
     * @return number of rows written
     * @throws com.powerwatch.backup.exception.PersistenceFailureException if the replace could not
     *         complete; the previous rows are left in place
     */
    int save(EntityKind kind, List<?> records);

    default int saveAlarms(List<AlarmRecord> alarms) {
        return save(EntityKind.ALARMS, alarms);
    }

    default int saveOutages(List<OutageRecord> outages) {
        return save(EntityKind.OUTAGES, outages);
    }

    default int saveJoined(List<JoinedRecord> joined) {
        return save(EntityKind.JOINED, joined);
    }

    List<AlarmRecord> loadAlarms();

    List<OutageRecord> loadOutages();

    List<JoinedRecord> loadJoined();

    /**
     * @return stored rows of {@code kind}, 0 if the table was never created
     */
    int count(EntityKind kind);
}

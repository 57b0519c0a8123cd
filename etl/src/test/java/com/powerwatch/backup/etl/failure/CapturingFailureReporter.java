package com.powerwatch.backup.etl.failure;

import java.util.ArrayList;
import java.util.List;

public class CapturingFailureReporter implements FailureReporter {

    private final List<FailureRecord> records = new ArrayList<>();

    @Override
    public void recordFailure(FailureRecord record) {
        records.add(record);
    }

    @Override
    public long getTotalFailures() {
        return records.size();
    }

    public List<FailureRecord> getRecords() {
        return records;
    }

    public List<FailureReason> getReasons() {
        return records.stream().map(FailureRecord::reasonCode).toList();
    }
}

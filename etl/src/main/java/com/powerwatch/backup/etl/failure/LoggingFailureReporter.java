package com.powerwatch.backup.etl.failure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Reports failures through the application log only.
 */
public class LoggingFailureReporter implements FailureReporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingFailureReporter.class);

    private final AtomicLong totalFailures = new AtomicLong(0);

    @Override
    public void recordFailure(FailureRecord record) {
        totalFailures.incrementAndGet();
        log.warn("{} ({}) in {} (sheet={}, row={}, column={}, value={}): {}",
            record.reasonCode(), record.reasonCode().getDescription(), record.inputFile(), record.sheet(), record.rowNumber(),
            record.column(), record.valueRaw(), record.reasonDetail());
    }

    @Override
    public long getTotalFailures() {
        return totalFailures.get();
    }
}

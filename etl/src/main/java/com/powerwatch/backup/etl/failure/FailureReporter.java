package com.powerwatch.backup.etl.failure;

/**
 * Receives every recoverable or fatal failure a run encounters. Components get one injected instead of
 * writing to a shared sink, so tests can capture what was reported.
 */
public interface FailureReporter {

    void recordFailure(FailureRecord record);

    long getTotalFailures();
}

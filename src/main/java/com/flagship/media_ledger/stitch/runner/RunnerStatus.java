package com.flagship.media_ledger.stitch.runner;

/**
 * Execution state as reported by the external job runner.
 */
public enum RunnerStatus {
    RUNNING,
    SUCCEEDED,
    FAILED
}

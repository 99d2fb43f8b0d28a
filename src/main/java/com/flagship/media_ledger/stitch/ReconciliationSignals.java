package com.flagship.media_ledger.stitch;

import com.flagship.media_ledger.stitch.runner.RunnerStatus;
import lombok.Value;

/**
 * Independent evidence about a job's real state. A null field means the
 * signal is unknown: it was not gathered or its source could not answer.
 */
@Value
public class ReconciliationSignals {
    Boolean outputExists;
    RunnerStatus runnerStatus;
    /** Free text the runner attached to its status, if any. */
    String runnerMessage;

    public static ReconciliationSignals outputPresent() {
        return new ReconciliationSignals(Boolean.TRUE, null, null);
    }

    public static ReconciliationSignals of(Boolean outputExists, RunnerStatus runnerStatus) {
        return new ReconciliationSignals(outputExists, runnerStatus, null);
    }

    public static ReconciliationSignals runnerReport(RunnerStatus status, String message) {
        return new ReconciliationSignals(null, status, message);
    }

    public static ReconciliationSignals none() {
        return new ReconciliationSignals(null, null, null);
    }
}

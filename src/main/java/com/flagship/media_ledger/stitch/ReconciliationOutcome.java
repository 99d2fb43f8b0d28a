package com.flagship.media_ledger.stitch;

import lombok.Value;

@Value
public class ReconciliationOutcome {
    StitchJob job;
    boolean changed;
    DecidingSignal decidedBy;

    static ReconciliationOutcome unchanged(StitchJob job) {
        return new ReconciliationOutcome(job, false, DecidingSignal.NONE);
    }

    static ReconciliationOutcome changed(StitchJob job, DecidingSignal decidedBy) {
        return new ReconciliationOutcome(job, true, decidedBy);
    }
}

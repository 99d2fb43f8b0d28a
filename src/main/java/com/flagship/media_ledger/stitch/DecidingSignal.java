package com.flagship.media_ledger.stitch;

public enum DecidingSignal {
    NONE,
    OUTPUT_PRESENT,
    RUNNER_STATUS,
    STALENESS
}

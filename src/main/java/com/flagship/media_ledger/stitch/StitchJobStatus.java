package com.flagship.media_ledger.stitch;

import java.util.List;

/**
 * QUEUED -> RUNNING -> COMPLETED | FAILED. QUEUED may also go straight to
 * COMPLETED or FAILED when reconciliation finds a conclusive signal first.
 */
public enum StitchJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public static final List<StitchJobStatus> ACTIVE = List.of(QUEUED, RUNNING);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(StitchJobStatus target) {
        return switch (this) {
            case QUEUED -> target == RUNNING || target == COMPLETED || target == FAILED;
            case RUNNING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}

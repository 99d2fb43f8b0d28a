package com.flagship.media_ledger.creation;

/**
 * Lifecycle of a creation.
 *
 * Valid transitions:
 * - PENDING -> PROCESSING, READY, FAILED (READY covers a completion that overtook its start event)
 * - PROCESSING -> READY, FAILED
 * - READY -> PUBLISHED
 * - FAILED, PUBLISHED -> (terminal)
 */
public enum CreationStatus {
    PENDING,
    PROCESSING,
    READY,
    PUBLISHED,
    FAILED;

    public boolean canTransitionTo(CreationStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING || target == READY || target == FAILED;
            case PROCESSING -> target == READY || target == FAILED;
            case READY -> target == PUBLISHED;
            case PUBLISHED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == PUBLISHED || this == FAILED;
    }

    /**
     * Still waiting on the generation worker.
     */
    public boolean isInFlight() {
        return this == PENDING || this == PROCESSING;
    }
}

package com.flagship.media_ledger.common.exception;

/**
 * The work could not be handed to its worker. Any charge for it has already
 * been refunded and the record marked FAILED when this reaches the caller.
 */
public class EnqueueFailureException extends RuntimeException {

    public EnqueueFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

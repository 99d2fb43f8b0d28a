package com.flagship.media_ledger.common.exception;

/**
 * Base type for lookups of records that do not exist; rendered as 404.
 */
public abstract class ResourceNotFoundException extends RuntimeException {

    protected ResourceNotFoundException(String message) {
        super(message);
    }
}

package com.flagship.media_ledger.common.exception;

public class NotOwnerException extends RuntimeException {

    public NotOwnerException(String resource, String userId) {
        super(resource + " is not owned by user " + userId);
    }
}

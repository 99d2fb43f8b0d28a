package com.flagship.media_ledger.common.exception;

public class SignatureInvalidException extends RuntimeException {

    public SignatureInvalidException(String message) {
        super(message);
    }

    public SignatureInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.flagship.media_ledger.stitch.runner;

public class JobRunnerException extends RuntimeException {

    public JobRunnerException(String message) {
        super(message);
    }

    public JobRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.flagship.media_ledger.common.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class AlreadyRunningException extends RuntimeException {

    private final String targetId;
    /** Null when the competing job was created concurrently and is not yet visible. */
    private final UUID activeJobId;

    public AlreadyRunningException(String targetId, UUID activeJobId) {
        super("A stitch job is already in progress for target " + targetId + ", retry later");
        this.targetId = targetId;
        this.activeJobId = activeJobId;
    }
}

package com.flagship.media_ledger.consumer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Status report published by generation workers on the results topic.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResultEvent {
    public static final String STARTED = "GenerationStarted";
    public static final String COMPLETED = "GenerationCompleted";
    public static final String FAILED = "GenerationFailed";

    private UUID eventId;
    private UUID creationId;
    private String eventType;
    private String outputRef;
    private String errorType;
    private String message;
    private Instant occurredAt;
}

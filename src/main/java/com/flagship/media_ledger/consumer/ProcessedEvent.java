package com.flagship.media_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of a generation result event handled by a consumer group.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    Outcome outcome;
    String note;

    public enum Outcome {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
            consumerGroup, now, Outcome.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant now,
                                         String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
            consumerGroup, now, Outcome.SKIPPED, reason);
    }
}

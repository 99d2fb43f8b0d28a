package com.flagship.media_ledger.webhook;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SecurityAlert {
    UUID id;
    String eventId;
    String userId;
    String activityType;
    String details;
    Status status;
    Instant createdAt;

    public enum Status {
        PENDING_REVIEW,
        RESOLVED
    }

    public static SecurityAlert pendingReview(String eventId, String userId, GuardViolation violation, Instant now) {
        return new SecurityAlert(UUID.randomUUID(), eventId, userId, violation.getActivityType(),
            violation.getDetails(), Status.PENDING_REVIEW, now);
    }
}

package com.flagship.media_ledger.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "security_alerts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SecurityAlertEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false, unique = true)
    private String eventId;

    @Column(name = "user_id", updatable = false, length = 128)
    private String userId;

    @Column(name = "activity_type", nullable = false, updatable = false, length = 64)
    private String activityType;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String details;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SecurityAlert.Status status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static SecurityAlertEntity fromDomain(SecurityAlert alert) {
        return new SecurityAlertEntity(
            alert.getId(),
            alert.getEventId(),
            alert.getUserId(),
            alert.getActivityType(),
            alert.getDetails(),
            alert.getStatus(),
            alert.getCreatedAt()
        );
    }

    public SecurityAlert toDomain() {
        return new SecurityAlert(id, eventId, userId, activityType, details, status, createdAt);
    }
}

package com.flagship.media_ledger.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Stores purchases held back for manual review, one alert per event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityAlertService {

    private final SecurityAlertRepository repository;
    private final Clock clock;

    public void record(String eventId, String userId, GuardViolation violation) {
        log.warn("SECURITY: {} for user {} on event {}: {}",
            violation.getActivityType(), userId, eventId, violation.getDetails());
        if (repository.existsByEventId(eventId)) {
            log.info("Security alert for event {} already recorded", eventId);
            return;
        }
        try {
            repository.save(SecurityAlertEntity.fromDomain(
                SecurityAlert.pendingReview(eventId, userId, violation, clock.instant())));
        } catch (DataIntegrityViolationException e) {
            log.info("Security alert for event {} recorded concurrently", eventId);
        }
    }

    public List<SecurityAlert> alertsFor(String userId) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId).stream()
            .map(SecurityAlertEntity::toDomain)
            .toList();
    }
}

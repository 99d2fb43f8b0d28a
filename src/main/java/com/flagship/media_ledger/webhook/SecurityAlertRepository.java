package com.flagship.media_ledger.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SecurityAlertRepository extends JpaRepository<SecurityAlertEntity, UUID> {

    boolean existsByEventId(String eventId);

    List<SecurityAlertEntity> findByUserIdOrderByCreatedAtDesc(String userId);
}

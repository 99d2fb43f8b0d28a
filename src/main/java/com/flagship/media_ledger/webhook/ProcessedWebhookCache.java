package com.flagship.media_ledger.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for webhook event ids that were already credited.
 *
 * Redis is optional: when it is missing or failing every lookup is a miss
 * and the ledger's unique (type, reference) index decides instead.
 */
@Component
@Slf4j
public class ProcessedWebhookCache {

    private static final String KEY_PREFIX = "webhook:processed:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public ProcessedWebhookCache(Optional<StringRedisTemplate> redisTemplate,
                                 @Value("${webhook.processed-cache-ttl:24h}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    public boolean isProcessed(String eventId) {
        if (redisTemplate.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.get().hasKey(KEY_PREFIX + eventId));
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for webhook event {}, falling back to the ledger: {}",
                eventId, e.getMessage());
            return false;
        }
    }

    public void markProcessed(String eventId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(KEY_PREFIX + eventId, "1", ttl);
        } catch (RuntimeException e) {
            log.debug("Failed to cache webhook event {} in Redis: {}", eventId, e.getMessage());
        }
    }
}

package com.flagship.media_ledger.observability;

import com.flagship.media_ledger.stitch.StitchJobReconciler;
import com.flagship.media_ledger.stitch.StitchJobRepository;
import com.flagship.media_ledger.stitch.StitchJobStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Readiness checks beyond the built-in datasource check.
 */
public class HealthIndicators {

    /**
     * Warns when stitch jobs sit past the staleness timeout, which means the
     * reconciliation scheduler is not keeping up or not running.
     */
    @Component("stitchBacklogHealth")
    public static class StitchBacklogHealthIndicator implements HealthIndicator {

        private static final long STALE_WARNING_THRESHOLD = 10;
        private static final long STALE_CRITICAL_THRESHOLD = 100;

        private final StitchJobRepository repository;
        private final StitchJobReconciler reconciler;
        private final Clock clock;

        public StitchBacklogHealthIndicator(StitchJobRepository repository,
                                            StitchJobReconciler reconciler,
                                            Clock clock) {
            this.repository = repository;
            this.reconciler = reconciler;
            this.clock = clock;
        }

        @Override
        public Health health() {
            try {
                long stale = repository.countByStatusInAndUpdatedAtBefore(
                    StitchJobStatus.ACTIVE, clock.instant().minus(reconciler.getStaleTimeout()));

                Health.Builder builder = stale < STALE_WARNING_THRESHOLD
                        ? Health.up()
                        : stale < STALE_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("staleJobs", stale)
                        .withDetail("staleTimeout", reconciler.getStaleTimeout().toString())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the webhook fast path, so an outage degrades rather than fails.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : degraded("Unexpected ping response " + result);
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Webhook deduplication falls back to the ledger")
                    .build();
        }
    }

    /**
     * Generation tasks cannot be enqueued without Kafka.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}

package com.flagship.media_ledger.webhook;

import com.flagship.media_ledger.ledger.TokenLedgerService;
import com.stripe.net.Webhook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Signed deliveries through the HTTP endpoint into the real ledger. Redis is
 * not running, so deduplication relies on the ledger alone.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class StripeWebhookControllerTest {

    private static final String SECRET = "whsec_integration";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("media_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.port", () -> "6399");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("reconciliation.scheduler.enabled", () -> "false");
        registry.add("webhook.stripe.secret", () -> SECRET);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TokenLedgerService ledgerService;

    @Autowired
    private SecurityAlertService alertService;

    private String userId;

    @BeforeEach
    void setUp() {
        userId = "user-" + UUID.randomUUID();
    }

    private String checkout(String eventId, String packageId, long amountTotal) {
        return "{\"id\":\"" + eventId + "\",\"type\":\"checkout.session.completed\",\"data\":{\"object\":{"
            + "\"payment_status\":\"paid\",\"amount_total\":" + amountTotal + ","
            + "\"metadata\":{\"user_id\":\"" + userId + "\",\"package_id\":\"" + packageId + "\"}}}}";
    }

    private ResultActions deliver(String payload, String secret) throws Exception {
        long timestamp = Instant.now().getEpochSecond();
        String header = "t=" + timestamp + ",v1=" + Webhook.Util.computeHmacSha256(secret, timestamp + "." + payload);
        return mockMvc.perform(post("/api/webhooks/stripe")
            .header("Stripe-Signature", header)
            .contentType(MediaType.APPLICATION_JSON)
            .content(payload));
    }

    @Test
    @DisplayName("Replayed delivery credits once")
    void replayCreditsOnce() throws Exception {
        String payload = checkout("evt_" + UUID.randomUUID(), "starter", 499);

        deliver(payload, SECRET).andExpect(status().isOk()).andExpect(jsonPath("$.result").value("ok"));
        deliver(payload, SECRET).andExpect(status().isOk()).andExpect(jsonPath("$.result").value("duplicate"));

        assertEquals(110, ledgerService.getBalance(userId));
    }

    @Test
    @DisplayName("Bad signature is 400 and credits nothing")
    void badSignature() throws Exception {
        deliver(checkout("evt_" + UUID.randomUUID(), "studio", 4999), "whsec_forged")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Signature"));

        assertEquals(0, ledgerService.getBalance(userId));
    }

    @Test
    @DisplayName("Sixth purchase within the hour is held for review")
    void hourlyRateLimit() throws Exception {
        for (int i = 0; i < 5; i++) {
            deliver(checkout("evt_" + UUID.randomUUID(), "tasting", 99), SECRET)
                .andExpect(jsonPath("$.result").value("ok"));
        }

        String flaggedEvent = "evt_" + UUID.randomUUID();
        deliver(checkout(flaggedEvent, "tasting", 99), SECRET)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result").value("flagged"));

        assertEquals(100, ledgerService.getBalance(userId));
        List<SecurityAlert> alerts = alertService.alertsFor(userId);
        assertEquals(1, alerts.size());
        assertEquals(flaggedEvent, alerts.get(0).getEventId());
        assertEquals(GuardViolation.RATE_LIMIT_EXCEEDED, alerts.get(0).getActivityType());
        assertEquals(SecurityAlert.Status.PENDING_REVIEW, alerts.get(0).getStatus());
    }
}

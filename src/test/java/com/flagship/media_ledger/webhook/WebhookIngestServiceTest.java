package com.flagship.media_ledger.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.media_ledger.common.exception.SignatureInvalidException;
import com.flagship.media_ledger.ledger.CreditResult;
import com.flagship.media_ledger.ledger.EntryType;
import com.flagship.media_ledger.ledger.LedgerEntry;
import com.flagship.media_ledger.ledger.TokenLedgerService;
import com.flagship.media_ledger.observability.MediaMetrics;
import com.stripe.net.Webhook;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookIngestServiceTest {

    private static final String SECRET = "whsec_test_secret";

    @Mock
    private TokenLedgerService ledgerService;
    @Mock
    private PurchaseGuard purchaseGuard;
    @Mock
    private SecurityAlertService alertService;
    @Mock
    private ProcessedWebhookCache processedCache;

    private WebhookIngestService service;

    @BeforeEach
    void setUp() {
        service = serviceWithSecret(SECRET);
    }

    private WebhookIngestService serviceWithSecret(String secret) {
        return new WebhookIngestService(ledgerService, purchaseGuard, alertService, processedCache,
            new ObjectMapper(), new MediaMetrics(new SimpleMeterRegistry()), secret, 300);
    }

    private static String sign(String payload, String secret) throws Exception {
        long timestamp = Instant.now().getEpochSecond();
        String signature = Webhook.Util.computeHmacSha256(secret, timestamp + "." + payload);
        return "t=" + timestamp + ",v1=" + signature;
    }

    private static String checkoutEvent(String eventId, String metadata, long amountTotal) {
        return """
            {"id":"%s","type":"checkout.session.completed","data":{"object":{
              "id":"cs_test_1","payment_status":"paid","amount_total":%d,
              "metadata":%s}}}
            """.formatted(eventId, amountTotal, metadata);
    }

    @Nested
    @DisplayName("Signature verification")
    class Signature {

        @Test
        @DisplayName("Payload signed with another secret is rejected before anything is read")
        void wrongSecretRejected() throws Exception {
            String payload = checkoutEvent("evt_1", "{\"user_id\":\"u1\",\"package_id\":\"starter\"}", 499);

            assertThrows(SignatureInvalidException.class,
                () -> service.receive(payload, sign(payload, "whsec_other")));
            verifyNoInteractions(ledgerService, processedCache);
        }

        @Test
        @DisplayName("Tampered payload is rejected")
        void tamperedPayloadRejected() throws Exception {
            String original = checkoutEvent("evt_1", "{\"user_id\":\"u1\",\"package_id\":\"starter\"}", 499);
            String header = sign(original, SECRET);
            String tampered = original.replace("starter", "studio");

            assertThrows(SignatureInvalidException.class, () -> service.receive(tampered, header));
        }

        @Test
        @DisplayName("Missing secret rejects every delivery")
        void missingSecretRejects() throws Exception {
            String payload = checkoutEvent("evt_1", "{\"user_id\":\"u1\",\"package_id\":\"starter\"}", 499);

            assertThrows(SignatureInvalidException.class,
                () -> serviceWithSecret("").receive(payload, sign(payload, SECRET)));
        }

        @Test
        void missingHeaderRejected() {
            assertThrows(SignatureInvalidException.class, () -> service.receive("{}", null));
        }
    }

    @Test
    @DisplayName("Paid checkout credits the catalogue amount for the package")
    void checkoutCreditsPackageTokens() throws Exception {
        String payload = checkoutEvent("evt_ok", "{\"user_id\":\"u1\",\"package_id\":\"popular\",\"tokens\":\"220\"}", 999);
        when(ledgerService.findEntry(EntryType.CREDIT, "evt_ok")).thenReturn(Optional.empty());
        when(purchaseGuard.check("u1", TokenPackage.POPULAR, 220L, 999L)).thenReturn(Optional.empty());
        when(ledgerService.creditFromExternalEvent("evt_ok", "u1", 220)).thenReturn(CreditResult.APPLIED);

        WebhookResult result = service.receive(payload, sign(payload, SECRET));

        assertEquals(WebhookResult.OK, result);
        verify(processedCache).markProcessed("evt_ok");
    }

    @Test
    @DisplayName("Redelivered event already in the ledger is a duplicate")
    void redeliveryIsDuplicate() throws Exception {
        String payload = checkoutEvent("evt_dup", "{\"user_id\":\"u1\",\"package_id\":\"starter\"}", 499);
        when(ledgerService.findEntry(EntryType.CREDIT, "evt_dup")).thenReturn(Optional.of(
            new LedgerEntry(UUID.randomUUID(), "u1", EntryType.CREDIT, 110, "evt_dup", "Purchase", Instant.now())));

        assertEquals(WebhookResult.DUPLICATE, service.receive(payload, sign(payload, SECRET)));
        verify(ledgerService, never()).creditFromExternalEvent(anyString(), anyString(), anyLong());
    }

    @Test
    @DisplayName("Event cached as processed skips the ledger lookup")
    void cachedEventIsDuplicate() throws Exception {
        String payload = checkoutEvent("evt_cached", "{\"user_id\":\"u1\",\"package_id\":\"starter\"}", 499);
        when(processedCache.isProcessed("evt_cached")).thenReturn(true);

        assertEquals(WebhookResult.DUPLICATE, service.receive(payload, sign(payload, SECRET)));
        verify(ledgerService, never()).findEntry(any(), anyString());
    }

    @Test
    @DisplayName("Guard violation stores an alert and credits nothing")
    void guardViolationFlags() throws Exception {
        String payload = checkoutEvent("evt_bad", "{\"user_id\":\"u1\",\"package_id\":\"starter\"}", 1);
        GuardViolation violation = new GuardViolation(GuardViolation.PRICE_MISMATCH, "paid 1 cent");
        when(ledgerService.findEntry(EntryType.CREDIT, "evt_bad")).thenReturn(Optional.empty());
        when(purchaseGuard.check("u1", TokenPackage.STARTER, null, 1L)).thenReturn(Optional.of(violation));

        assertEquals(WebhookResult.FLAGGED, service.receive(payload, sign(payload, SECRET)));
        verify(alertService).record("evt_bad", "u1", violation);
        verify(ledgerService, never()).creditFromExternalEvent(anyString(), anyString(), anyLong());
    }

    @Test
    @DisplayName("Unknown package is flagged without consulting the guard")
    void unknownPackageFlagged() throws Exception {
        String payload = checkoutEvent("evt_pkg", "{\"user_id\":\"u1\",\"package_id\":\"mega\"}", 99999);
        when(ledgerService.findEntry(EntryType.CREDIT, "evt_pkg")).thenReturn(Optional.empty());

        assertEquals(WebhookResult.FLAGGED, service.receive(payload, sign(payload, SECRET)));
        verify(alertService).record(eq("evt_pkg"), eq("u1"),
            argThat(v -> GuardViolation.INVALID_PACKAGE.equals(v.getActivityType())));
        verifyNoInteractions(purchaseGuard);
    }

    @Test
    @DisplayName("Checkout without a user id is acknowledged and ignored")
    void missingUserIgnored() throws Exception {
        String payload = checkoutEvent("evt_nouser", "{\"package_id\":\"starter\"}", 499);
        when(ledgerService.findEntry(EntryType.CREDIT, "evt_nouser")).thenReturn(Optional.empty());

        assertEquals(WebhookResult.IGNORED, service.receive(payload, sign(payload, SECRET)));
        verify(ledgerService, never()).creditFromExternalEvent(anyString(), anyString(), anyLong());
    }

    @Test
    @DisplayName("Other event types are acknowledged and ignored")
    void otherTypesIgnored() throws Exception {
        String payload = "{\"id\":\"evt_x\",\"type\":\"customer.created\",\"data\":{\"object\":{}}}";

        assertEquals(WebhookResult.IGNORED, service.receive(payload, sign(payload, SECRET)));
        verifyNoInteractions(ledgerService, purchaseGuard, alertService);
    }

    @Test
    @DisplayName("Credit lost to a concurrent delivery reports a duplicate")
    void concurrentDeliveryDuplicate() throws Exception {
        String payload = checkoutEvent("evt_race", "{\"user_id\":\"u1\",\"package_id\":\"tasting\"}", 99);
        when(ledgerService.findEntry(EntryType.CREDIT, "evt_race")).thenReturn(Optional.empty());
        when(purchaseGuard.check("u1", TokenPackage.TASTING, null, 99L)).thenReturn(Optional.empty());
        when(ledgerService.creditFromExternalEvent("evt_race", "u1", 20)).thenReturn(CreditResult.DUPLICATE);

        assertEquals(WebhookResult.DUPLICATE, service.receive(payload, sign(payload, SECRET)));
    }
}

package com.flagship.media_ledger.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.media_ledger.common.exception.SignatureInvalidException;
import com.flagship.media_ledger.ledger.CreditResult;
import com.flagship.media_ledger.ledger.EntryType;
import com.flagship.media_ledger.ledger.TokenLedgerService;
import com.flagship.media_ledger.observability.MediaMetrics;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns verified Stripe events into token credits.
 *
 * The event id is the ledger reference of the credit, so a redelivered
 * event can never credit twice. Only {@code checkout.session.completed}
 * with a paid session moves tokens; every other type is acknowledged and
 * ignored.
 */
@Service
@Slf4j
public class WebhookIngestService {

    static final String CHECKOUT_COMPLETED = "checkout.session.completed";
    private static final String EVENT_ID_MDC_KEY = "eventId";

    private final TokenLedgerService ledgerService;
    private final PurchaseGuard purchaseGuard;
    private final SecurityAlertService alertService;
    private final ProcessedWebhookCache processedCache;
    private final ObjectMapper objectMapper;
    private final MediaMetrics metrics;
    private final String endpointSecret;
    private final long toleranceSeconds;

    public WebhookIngestService(TokenLedgerService ledgerService,
                                PurchaseGuard purchaseGuard,
                                SecurityAlertService alertService,
                                ProcessedWebhookCache processedCache,
                                ObjectMapper objectMapper,
                                MediaMetrics metrics,
                                @Value("${webhook.stripe.secret:}") String endpointSecret,
                                @Value("${webhook.stripe.tolerance-seconds:300}") long toleranceSeconds) {
        this.ledgerService = ledgerService;
        this.purchaseGuard = purchaseGuard;
        this.alertService = alertService;
        this.processedCache = processedCache;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.endpointSecret = endpointSecret;
        this.toleranceSeconds = toleranceSeconds;
    }

    /**
     * Verifies and applies one delivery.
     *
     * @throws SignatureInvalidException when the secret is not configured or
     *         the signature header does not match the payload
     * @throws IllegalArgumentException when a verified payload is not a Stripe event
     */
    public WebhookResult receive(String payload, String signatureHeader) {
        long started = System.nanoTime();
        verify(payload, signatureHeader);

        JsonNode event = parse(payload);
        String eventId = text(event, "id");
        String eventType = text(event, "type");
        if (eventId == null || eventType == null) {
            throw new IllegalArgumentException("Webhook event is missing id or type");
        }

        try (MDC.MDCCloseable ignored = MDC.putCloseable(EVENT_ID_MDC_KEY, eventId)) {
            WebhookResult result = CHECKOUT_COMPLETED.equals(eventType)
                ? handleCheckoutCompleted(eventId, event.path("data").path("object"))
                : WebhookResult.IGNORED;

            log.info("Webhook event {} ({}) handled: {}", eventId, eventType, result);
            metrics.recordWebhook(eventType, result.name());
            return result;
        } finally {
            metrics.recordLatency("webhook.receive", Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private void verify(String payload, String signatureHeader) {
        if (endpointSecret == null || endpointSecret.isBlank()) {
            log.error("Stripe webhook secret is not configured, rejecting delivery");
            throw new SignatureInvalidException("Webhook secret is not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new SignatureInvalidException("Missing Stripe-Signature header");
        }
        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, endpointSecret, toleranceSeconds);
        } catch (SignatureVerificationException e) {
            log.warn("Rejected webhook with invalid signature: {}", e.getMessage());
            throw new SignatureInvalidException("Invalid Stripe signature", e);
        }
    }

    private JsonNode parse(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook payload is not valid JSON", e);
        }
    }

    private WebhookResult handleCheckoutCompleted(String eventId, JsonNode session) {
        if (processedCache.isProcessed(eventId)
                || ledgerService.findEntry(EntryType.CREDIT, eventId).isPresent()) {
            log.info("Webhook event {} already credited", eventId);
            return WebhookResult.DUPLICATE;
        }

        String paymentStatus = text(session, "payment_status");
        if (paymentStatus != null && !"paid".equals(paymentStatus)) {
            log.info("Checkout session for event {} not paid ({}), skipping", eventId, paymentStatus);
            return WebhookResult.IGNORED;
        }

        JsonNode metadata = session.path("metadata");
        String userId = Optional.ofNullable(text(metadata, "user_id"))
            .orElse(text(session, "client_reference_id"));
        if (userId == null) {
            log.error("Checkout event {} carries no user id, cannot credit tokens", eventId);
            return WebhookResult.IGNORED;
        }

        String packageId = text(metadata, "package_id");
        Optional<TokenPackage> tokenPackage = TokenPackage.findById(packageId);
        if (tokenPackage.isEmpty()) {
            return flag(eventId, userId, new GuardViolation(GuardViolation.INVALID_PACKAGE,
                "Unknown package " + packageId));
        }

        Long claimedTokens;
        try {
            claimedTokens = number(metadata, "tokens");
        } catch (NumberFormatException e) {
            return flag(eventId, userId, new GuardViolation(GuardViolation.TOKEN_MISMATCH,
                "Unparseable token count " + text(metadata, "tokens")));
        }
        Long amountTotal = session.path("amount_total").isIntegralNumber()
            ? session.path("amount_total").asLong()
            : null;

        Optional<GuardViolation> violation =
            purchaseGuard.check(userId, tokenPackage.get(), claimedTokens, amountTotal);
        if (violation.isPresent()) {
            return flag(eventId, userId, violation.get());
        }

        CreditResult credit = ledgerService.creditFromExternalEvent(
            eventId, userId, tokenPackage.get().getTokens());
        processedCache.markProcessed(eventId);
        if (credit == CreditResult.APPLIED) {
            log.info("Credited {} tokens ({}) to user {} for event {}",
                tokenPackage.get().getTokens(), tokenPackage.get().getId(), userId, eventId);
            return WebhookResult.OK;
        }
        return WebhookResult.DUPLICATE;
    }

    private WebhookResult flag(String eventId, String userId, GuardViolation violation) {
        alertService.record(eventId, userId, violation);
        return WebhookResult.FLAGGED;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Long number(JsonNode node, String field) {
        String value = text(node, field);
        return value == null ? null : Long.valueOf(value.trim());
    }
}

package com.flagship.media_ledger.webhook;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Stripe delivery endpoint. The body is taken raw because the signature
 * covers the exact bytes sent.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class StripeWebhookController {

    private final WebhookIngestService ingestService;

    @PostMapping("/stripe")
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody String payload,
            @RequestHeader(value = "Stripe-Signature", required = false) String signature) {
        WebhookResult result = ingestService.receive(payload, signature);
        return ResponseEntity.ok(Map.of("result", result.name().toLowerCase()));
    }
}

package com.flagship.media_ledger.webhook;

/**
 * Outcome of one webhook delivery. All of them are acknowledged with 200 so
 * the provider stops retrying; FLAGGED deliveries wait for manual review.
 */
public enum WebhookResult {
    OK,
    DUPLICATE,
    IGNORED,
    FLAGGED
}

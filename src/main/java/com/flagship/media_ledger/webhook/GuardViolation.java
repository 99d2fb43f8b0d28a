package com.flagship.media_ledger.webhook;

import lombok.Value;

/**
 * Why a purchase credit was held back.
 */
@Value
public class GuardViolation {
    public static final String INVALID_PACKAGE = "INVALID_PACKAGE";
    public static final String TOKEN_MISMATCH = "TOKEN_MISMATCH";
    public static final String PRICE_MISMATCH = "PRICE_MISMATCH";
    public static final String EXCESSIVE_AMOUNT = "EXCESSIVE_AMOUNT";
    public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";

    String activityType;
    String details;
}

package com.flagship.media_ledger.ledger;

public enum CreditResult {
    APPLIED,
    DUPLICATE
}

package com.flagship.media_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable row of the token ledger.
 * The (entryType, referenceId) pair is unique across the whole ledger.
 */
@Value
public class LedgerEntry {
    UUID id;
    String userId;
    EntryType entryType;
    long amount;
    String referenceId;
    String description;
    Instant createdAt;
}

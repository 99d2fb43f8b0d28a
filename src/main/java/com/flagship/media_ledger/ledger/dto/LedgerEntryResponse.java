package com.flagship.media_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.media_ledger.ledger.EntryType;
import com.flagship.media_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    EntryType type;

    @JsonProperty("amount")
    long amount;

    /** Balance effect: negative for debits. */
    @JsonProperty("signed_amount")
    long signedAmount;

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .type(entry.getEntryType())
            .amount(entry.getAmount())
            .signedAmount(entry.getEntryType().signedAmount(entry.getAmount()))
            .referenceId(entry.getReferenceId())
            .description(entry.getDescription())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}

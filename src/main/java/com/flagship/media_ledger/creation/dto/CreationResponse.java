package com.flagship.media_ledger.creation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.media_ledger.creation.Creation;
import com.flagship.media_ledger.creation.CreationKind;
import com.flagship.media_ledger.creation.CreationStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("kind")
    CreationKind kind;

    @JsonProperty("prompt")
    String prompt;

    @JsonProperty("aspect_ratio")
    String aspectRatio;

    @JsonProperty("cost")
    long cost;

    @JsonProperty("status")
    CreationStatus status;

    /** Time-limited; never the raw storage path. */
    @JsonProperty("output_url")
    String outputUrl;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("refunded")
    boolean refunded;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static CreationResponse from(Creation creation, String outputUrl) {
        return CreationResponse.builder()
            .id(creation.getId())
            .ownerId(creation.getOwnerId())
            .kind(creation.getKind())
            .prompt(creation.getPrompt())
            .aspectRatio(creation.getAspectRatio())
            .cost(creation.getCost())
            .status(creation.getStatus())
            .outputUrl(outputUrl)
            .failureReason(creation.getFailureReason())
            .refunded(creation.isRefunded())
            .createdAt(creation.getCreatedAt())
            .updatedAt(creation.getUpdatedAt())
            .build();
    }
}

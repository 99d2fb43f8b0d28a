package com.flagship.media_ledger.stitch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.media_ledger.stitch.StitchJob;
import com.flagship.media_ledger.stitch.StitchJobStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StitchJobResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("target_id")
    String targetId;

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("input_paths")
    List<String> inputPaths;

    @JsonProperty("status")
    StitchJobStatus status;

    @JsonProperty("message")
    String message;

    @JsonProperty("output_url")
    String outputUrl;

    @JsonProperty("cost")
    long cost;

    @JsonProperty("refunded")
    boolean refunded;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static StitchJobResponse from(StitchJob job, String outputUrl) {
        return StitchJobResponse.builder()
            .id(job.getId())
            .targetId(job.getTargetId())
            .ownerId(job.getOwnerId())
            .inputPaths(job.getInputPaths())
            .status(job.getStatus())
            .message(job.getMessage())
            .outputUrl(outputUrl)
            .cost(job.getCost())
            .refunded(job.isRefunded())
            .createdAt(job.getCreatedAt())
            .updatedAt(job.getUpdatedAt())
            .completedAt(job.getCompletedAt())
            .build();
    }
}

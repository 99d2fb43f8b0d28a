package com.flagship.media_ledger.stitch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.media_ledger.stitch.runner.RunnerStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class RunnerCallbackRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    RunnerStatus status;

    @JsonProperty("message")
    String message;
}

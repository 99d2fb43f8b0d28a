package com.flagship.media_ledger.stitch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

@Value
public class EnqueueStitchRequest {

    /** Ordered; the output plays the inputs back to back in this order. */
    @NotEmpty(message = "Input paths are required")
    @JsonProperty("input_paths")
    List<String> inputPaths;
}

package com.flagship.media_ledger.creation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.media_ledger.creation.CreationKind;
import com.flagship.media_ledger.creation.CreationService;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreateCreationRequest {

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    CreationKind kind;

    @NotBlank(message = "Prompt is required")
    @Size(max = CreationService.MAX_PROMPT_LENGTH, message = "Prompt must be at most 500 characters")
    @JsonProperty("prompt")
    String prompt;

    @Pattern(regexp = "^\\d{1,2}:\\d{1,2}$", message = "Aspect ratio must look like 16:9")
    @JsonProperty("aspect_ratio")
    String aspectRatio;
}

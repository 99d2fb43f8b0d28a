package com.flagship.media_ledger.creation;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Message placed on the generation task topic for a worker to pick up.
 */
@Value
public class GenerationTask {
    UUID creationId;
    String ownerId;
    CreationKind kind;
    String prompt;
    String aspectRatio;
    String outputPath;
    Instant requestedAt;

    public static GenerationTask from(Creation creation) {
        return new GenerationTask(
            creation.getId(),
            creation.getOwnerId(),
            creation.getKind(),
            creation.getPrompt(),
            creation.getAspectRatio(),
            creation.expectedOutputPath(),
            creation.getCreatedAt()
        );
    }
}

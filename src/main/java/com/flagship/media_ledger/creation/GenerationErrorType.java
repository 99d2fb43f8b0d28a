package com.flagship.media_ledger.creation;

/**
 * Failure classification reported by generation workers.
 */
public enum GenerationErrorType {
    CONTENT_POLICY_BLOCK("Blocked by content policy"),
    TRANSIENT_FAILURE("Temporary generation failure"),
    QUOTA_EXCEEDED("Generation quota exceeded");

    private final String description;

    GenerationErrorType(String description) {
        this.description = description;
    }

    /**
     * Builds the failure reason stored on the creation.
     */
    public String describe(String detail) {
        if (detail == null || detail.isBlank()) {
            return name() + ": " + description;
        }
        return name() + ": " + detail;
    }

    /**
     * Lenient parse of the worker-supplied value; unknown values map to null.
     */
    public static GenerationErrorType fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        for (GenerationErrorType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}

package com.tumorboard.llm;

/**
 * Unified failure of a variant assessment. {@link Kind} tells the retried transport
 * failure apart from deterministic problems with the model's output.
 */
public class LlmServiceException extends Exception {

    public enum Kind {
        /** Gene, variant or tumor type missing before any call was made. */
        INVALID_INPUT,
        /** Completion call failed on every attempt, or returned empty content. */
        COMPLETION_FAILED,
        /** Response text was not a JSON object. Never retried. */
        INVALID_JSON,
        /** JSON did not fit the assessment schema. Never retried. */
        INVALID_SCHEMA
    }

    private final Kind kind;

    public LlmServiceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LlmServiceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

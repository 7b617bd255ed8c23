package com.tumorboard.llm.completion;

import java.io.IOException;

/**
 * Failure of a single completion call: transport error, error status, or empty content.
 */
public class CompletionException extends IOException {

    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.tumorboard.llm.completion;

import java.io.IOException;

/**
 * Interface for LLM completion endpoints.
 * Each implementation handles the request/response format of one provider family.
 */
public interface CompletionClient {

    /**
     * Get the provider name this implementation handles.
     */
    String getProviderName();

    /**
     * Send the messages and return the assistant's text.
     *
     * @return non-blank response content
     * @throws CompletionException if the endpoint fails or returns empty content
     */
    String complete(CompletionRequest request) throws IOException, InterruptedException;
}

package com.tumorboard.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.AppLogger;
import com.tumorboard.llm.completion.ChatMessage;
import com.tumorboard.llm.completion.CompletionClient;
import com.tumorboard.llm.completion.CompletionRequest;
import com.tumorboard.models.ActionabilityAssessment;
import com.tumorboard.models.Evidence;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * LLM-based variant assessment: prompt, completion call with retry, response parsing.
 *
 * Only the completion call is retried. Malformed output is deterministic and fails at once.
 */
public class LlmService {

    private final CompletionClient client;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final RetryPolicy retryPolicy;
    private final AssessmentResponseParser parser;
    private final AppLogger logger = AppLogger.get();

    public LlmService(CompletionClient client, String model, double temperature, int maxTokens,
                      RetryPolicy retryPolicy, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client");
        this.model = Objects.requireNonNull(model, "model");
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.parser = new AssessmentResponseParser(mapper);
    }

    public String getModel() {
        return model;
    }

    /**
     * Assess variant actionability from the aggregated evidence.
     *
     * @throws LlmServiceException if an input is blank, the completion call fails on every
     *                             attempt, or the response is not valid JSON or does not fit the schema
     */
    public ActionabilityAssessment assessVariant(String gene, String variant, String tumorType, Evidence evidence)
        throws LlmServiceException, InterruptedException {
        if (tumorType == null || tumorType.isBlank()) {
            throw new LlmServiceException(LlmServiceException.Kind.INVALID_INPUT, "tumor_type is required");
        }
        List<ChatMessage> messages;
        try {
            String evidenceSummary = evidence != null ? evidence.summary() : Evidence.empty(gene, variant).summary();
            messages = AssessmentPrompts.buildMessages(gene, variant, tumorType, evidenceSummary);
        } catch (IllegalArgumentException e) {
            throw new LlmServiceException(LlmServiceException.Kind.INVALID_INPUT,
                "Cannot build assessment prompt: " + e.getMessage(), e);
        }

        logger.info("Assessing " + gene + " " + variant + " in " + tumorType);
        String response = callLlm(messages);
        logger.debug("Raw LLM response for " + gene + " " + variant + ": " + response);

        JsonNode data = parser.extractJson(response);
        ActionabilityAssessment assessment = parser.toAssessment(data, gene, variant, tumorType);

        logger.info("Assessment complete for " + gene + " " + variant + ": " + assessment.getTier().getLabel()
            + " (confidence: " + String.format(Locale.ROOT, "%.2f%%", assessment.getConfidenceScore() * 100) + ")");
        return assessment;
    }

    String callLlm(List<ChatMessage> messages) throws LlmServiceException, InterruptedException {
        CompletionRequest request = new CompletionRequest(model, messages, temperature, maxTokens);
        try {
            return retryPolicy.execute("LLM call (" + model + ")", () -> client.complete(request));
        } catch (RetryPolicy.RetryFailedException e) {
            logger.error("LLM API call failed: " + e.getMessage());
            throw new LlmServiceException(LlmServiceException.Kind.COMPLETION_FAILED,
                "LLM API call failed: " + e.getMessage(), e.getCause());
        }
    }
}

package com.tumorboard.llm.completion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client (OpenAI, OpenRouter, LM Studio, vLLM and similar).
 */
public class OpenAiCompatibleCompletionClient extends AbstractCompletionClient {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";

    public OpenAiCompatibleCompletionClient(ObjectMapper mapper, HttpClient httpClient, String baseUrl,
                                            String apiKey, Duration timeout) {
        super(mapper, httpClient, stripVersionSuffix(baseUrl), DEFAULT_BASE_URL, apiKey, timeout);
    }

    @Override
    public String getProviderName() {
        return "openai";
    }

    @Override
    public String complete(CompletionRequest request) throws IOException, InterruptedException {
        String url = baseUrl + "/v1/chat/completions";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", request.getModel());
        ArrayNode messages = payload.putArray("messages");
        for (ChatMessage message : request.getMessages()) {
            ObjectNode msg = messages.addObject();
            msg.put("role", message.getRole());
            msg.put("content", message.getContent());
        }
        payload.put("temperature", request.getTemperature());
        payload.put("max_tokens", request.getMaxTokens());

        Map<String, String> headers = new HashMap<>();
        if (apiKey != null) {
            headers.put("Authorization", "Bearer " + apiKey);
        }
        JsonNode response = sendJsonPost(url, payload, headers);

        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.size() == 0) {
            throw new CompletionException("Empty response from LLM");
        }
        return requireContent(choices.get(0).path("message").path("content"));
    }

    private static String stripVersionSuffix(String baseUrl) {
        if (baseUrl == null) {
            return null;
        }
        String url = normalizeBaseUrl(baseUrl, DEFAULT_BASE_URL);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}

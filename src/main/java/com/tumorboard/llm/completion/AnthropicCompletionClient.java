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

public class AnthropicCompletionClient extends AbstractCompletionClient {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String API_VERSION = "2023-06-01";

    public AnthropicCompletionClient(ObjectMapper mapper, HttpClient httpClient, String baseUrl,
                                     String apiKey, Duration timeout) {
        super(mapper, httpClient, baseUrl, DEFAULT_BASE_URL, apiKey, timeout);
    }

    @Override
    public String getProviderName() {
        return "anthropic";
    }

    @Override
    public String complete(CompletionRequest request) throws IOException, InterruptedException {
        String url = baseUrl + "/v1/messages";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", stripProviderPrefix(request.getModel()));
        payload.put("max_tokens", request.getMaxTokens());
        payload.put("temperature", request.getTemperature());

        // The Messages API takes the system prompt as a top-level field
        StringBuilder system = new StringBuilder();
        ArrayNode messages = payload.putArray("messages");
        for (ChatMessage message : request.getMessages()) {
            if (ChatMessage.ROLE_SYSTEM.equals(message.getRole())) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.getContent());
                continue;
            }
            ObjectNode msg = messages.addObject();
            msg.put("role", message.getRole());
            msg.put("content", message.getContent());
        }
        if (system.length() > 0) {
            payload.put("system", system.toString());
        }

        Map<String, String> headers = new HashMap<>();
        headers.put("x-api-key", apiKey);
        headers.put("anthropic-version", API_VERSION);
        JsonNode response = sendJsonPost(url, payload, headers);

        JsonNode content = response.path("content");
        if (!content.isArray() || content.size() == 0) {
            throw new CompletionException("Empty response from LLM");
        }
        return requireContent(content.get(0).path("text"));
    }

    private static String stripProviderPrefix(String model) {
        return model.startsWith("anthropic/") ? model.substring("anthropic/".length()) : model;
    }
}

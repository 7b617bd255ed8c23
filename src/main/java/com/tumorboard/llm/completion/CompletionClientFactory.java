package com.tumorboard.llm.completion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.AppConfig;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;

/**
 * Picks the completion transport for a model identifier.
 * Claude models go to the Anthropic Messages API; everything else to an OpenAI-compatible endpoint.
 */
public class CompletionClientFactory {

    private final ObjectMapper mapper;
    private final AppConfig config;
    private final HttpClient httpClient;

    public CompletionClientFactory(ObjectMapper mapper, AppConfig config) {
        this.mapper = mapper;
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    public CompletionClient forModel(String model) {
        if (isAnthropicModel(model)) {
            return new AnthropicCompletionClient(mapper, httpClient, config.getAnthropicBaseUrl(),
                config.getAnthropicApiKey(), config.getCompletionTimeout());
        }
        return new OpenAiCompatibleCompletionClient(mapper, httpClient, config.getOpenAiBaseUrl(),
            config.getOpenAiApiKey(), config.getCompletionTimeout());
    }

    public static boolean isAnthropicModel(String model) {
        if (model == null) {
            return false;
        }
        String lower = model.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("claude") || lower.startsWith("anthropic/");
    }
}

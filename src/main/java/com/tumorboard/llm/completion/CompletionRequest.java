package com.tumorboard.llm.completion;

import java.util.List;

public final class CompletionRequest {

    private final String model;
    private final List<ChatMessage> messages;
    private final double temperature;
    private final int maxTokens;

    public CompletionRequest(String model, List<ChatMessage> messages, double temperature, int maxTokens) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model is required.");
        }
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required.");
        }
        this.model = model;
        this.messages = List.copyOf(messages);
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public String getModel() {
        return model;
    }

    public List<ChatMessage> getMessages() {
        return messages;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }
}

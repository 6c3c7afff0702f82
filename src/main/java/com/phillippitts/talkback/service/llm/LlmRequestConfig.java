package com.phillippitts.talkback.service.llm;

import java.util.Objects;

/**
 * Per-request language-model settings.
 *
 * @param model       provider model identifier
 * @param maxTokens   maximum tokens to generate
 * @param temperature sampling temperature (0.0 - 2.0)
 */
public record LlmRequestConfig(String model, int maxTokens, double temperature) {

    public static final LlmRequestConfig DEFAULT = new LlmRequestConfig("gpt-4o", 1024, 0.7);

    public LlmRequestConfig {
        Objects.requireNonNull(model, "model must not be null");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0, got: " + temperature);
        }
    }
}

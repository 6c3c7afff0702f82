package com.phillippitts.talkback.config.properties;

import com.phillippitts.talkback.service.llm.LlmRequestConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for language-model requests.
 */
@Validated
@ConfigurationProperties(prefix = "conversation.llm")
public class LanguageModelProperties {

    private final String model;

    @Min(1)
    private final int maxTokens;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    @ConstructorBinding
    public LanguageModelProperties(String model, Integer maxTokens, Double temperature) {
        this.model = (model == null || model.isBlank()) ? LlmRequestConfig.DEFAULT.model() : model;
        this.maxTokens = maxTokens == null ? LlmRequestConfig.DEFAULT.maxTokens() : maxTokens;
        this.temperature = temperature == null ? LlmRequestConfig.DEFAULT.temperature() : temperature;
    }

    public LlmRequestConfig toRequestConfig() {
        return new LlmRequestConfig(model, maxTokens, temperature);
    }

    public String getModel() { return model; }
    public int getMaxTokens() { return maxTokens; }
    public double getTemperature() { return temperature; }
}

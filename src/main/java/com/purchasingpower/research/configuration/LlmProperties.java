package com.purchasingpower.research.configuration;

import com.purchasingpower.research.config.RetryProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Language model settings shared by the decomposer, extractor and synthesizer.
 *
 * <p>{@code provider} selects the backend ("anthropic" or "gemini"). {@code baseUrl}
 * and {@code apiVersion} may be left blank to use the backend's public endpoint.
 */
@Data
public class LlmProperties {

    @NotBlank
    private String provider = "anthropic";

    @NotBlank(message = "app.llm.api-key is required (set LLM_API_KEY, or ANTHROPIC_API_KEY for the anthropic backend)")
    private String apiKey;

    @NotBlank
    private String model = "claude-sonnet-4-20250514";

    private String baseUrl;

    private String apiVersion;

    @Positive
    private int maxTokens = 4000;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.3;

    @Positive
    private int maxResponseBytes = 16 * 1024 * 1024;

    @Valid
    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();
}

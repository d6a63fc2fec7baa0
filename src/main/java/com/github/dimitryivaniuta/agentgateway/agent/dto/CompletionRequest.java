package com.github.dimitryivaniuta.agentgateway.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Completion request. Missing optional fields take the defaults below.
 *
 * @param prompt      user prompt, required
 * @param agent       upstream provider name, default {@code openai}
 * @param model       provider model, null for the provider default
 * @param temperature sampling temperature, default 0.7
 * @param maxTokens   completion token cap, default 2048
 * @param stream      accepted for compatibility; responses are always returned whole
 */
public record CompletionRequest(
        @NotBlank String prompt,
        String agent,
        String model,
        @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
        @JsonProperty("max_tokens") @Min(1) @Max(200_000) Integer maxTokens,
        Boolean stream
) {

    public static final String DEFAULT_AGENT = "openai";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 2048;

    public CompletionRequest {
        if (agent == null || agent.isBlank()) agent = DEFAULT_AGENT;
        if (model != null && model.isBlank()) model = null;
        if (temperature == null) temperature = DEFAULT_TEMPERATURE;
        if (maxTokens == null) maxTokens = DEFAULT_MAX_TOKENS;
        if (stream == null) stream = Boolean.FALSE;
    }

    public static CompletionRequest of(String prompt, String agent) {
        return new CompletionRequest(prompt, agent, null, null, null, null);
    }
}

package com.github.dimitryivaniuta.agentgateway.agent.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.agentgateway.agent.CompletionProvider;
import com.github.dimitryivaniuta.agentgateway.agent.ProviderProperties;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import com.github.dimitryivaniuta.agentgateway.retry.UpstreamRetry;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API.
 */
@Component
public class ClaudeCompletionProvider implements CompletionProvider {

    private final RestClient client;
    private final String defaultModel;
    private final boolean configured;

    public ClaudeCompletionProvider(ProviderProperties props, RestClient.Builder builder) {
        ProviderProperties.Anthropic anthropic = props.getAnthropic();
        this.configured = StringUtils.hasText(anthropic.getApiKey());
        this.defaultModel = anthropic.getModel();

        builder.baseUrl(anthropic.getBaseUrl())
                .defaultHeader("anthropic-version", anthropic.getApiVersion());
        if (configured) {
            builder.defaultHeader("x-api-key", anthropic.getApiKey());
        }
        this.client = builder.build();
    }

    @Override
    public String name() {
        return "claude";
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public String notConfiguredMessage() {
        return "Anthropic API key not configured";
    }

    @Override
    public List<String> models() {
        return List.of("claude-3-5-sonnet-20241022", "claude-3-opus-20240229", "claude-3-haiku-20240307");
    }

    @Override
    @UpstreamRetry(name = "claude.completion")
    public CompletionResponse complete(CompletionRequest request) {
        String model = request.model() != null ? request.model() : defaultModel;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", request.maxTokens());
        payload.put("temperature", request.temperature());
        payload.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));

        JsonNode body = client.post()
                .uri("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        JsonNode text = body == null ? null : body.path("content").path(0).path("text");
        return new CompletionResponse(
                ProviderResponses.requireText(name(), text, "content[0].text"),
                name(),
                model,
                ProviderResponses.usage(body.get("usage"))
        );
    }
}

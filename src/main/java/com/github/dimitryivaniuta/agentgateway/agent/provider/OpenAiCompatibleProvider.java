package com.github.dimitryivaniuta.agentgateway.agent.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.agentgateway.agent.CompletionProvider;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for backends speaking the {@code /chat/completions} protocol.
 */
abstract class OpenAiCompatibleProvider implements CompletionProvider {

    private final RestClient client;
    private final String defaultModel;

    protected OpenAiCompatibleProvider(RestClient client, String defaultModel) {
        this.client = client;
        this.defaultModel = defaultModel;
    }

    protected CompletionResponse chat(CompletionRequest request) {
        String model = request.model() != null ? request.model() : defaultModel;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));
        payload.put("temperature", request.temperature());
        payload.put("max_tokens", request.maxTokens());

        JsonNode body = client.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        JsonNode content = body == null ? null : body.path("choices").path(0).path("message").path("content");
        String text = ProviderResponses.requireText(name(), content, "choices[0].message.content");
        return new CompletionResponse(text, name(), model, ProviderResponses.usage(body.get("usage")));
    }
}

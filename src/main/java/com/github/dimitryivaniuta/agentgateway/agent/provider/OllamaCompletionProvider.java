package com.github.dimitryivaniuta.agentgateway.agent.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.agentgateway.agent.CompletionProvider;
import com.github.dimitryivaniuta.agentgateway.agent.ProviderProperties;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import com.github.dimitryivaniuta.agentgateway.retry.UpstreamRetry;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class OllamaCompletionProvider implements CompletionProvider {

    private final RestClient client;
    private final String defaultModel;

    public OllamaCompletionProvider(ProviderProperties props, RestClient.Builder builder) {
        this.client = builder.baseUrl(props.getOllama().getUrl()).build();
        this.defaultModel = props.getOllama().getModel();
    }

    @Override
    public String name() {
        return "ollama";
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public List<String> models() {
        return List.of("llama3.2", "mistral", "codellama");
    }

    @Override
    public String note() {
        return "Optional container, started with the ollama profile";
    }

    @Override
    @UpstreamRetry(name = "ollama.completion")
    public CompletionResponse complete(CompletionRequest request) {
        String model = request.model() != null ? request.model() : defaultModel;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", request.prompt());
        payload.put("stream", false);
        payload.put("options", Map.of(
                "temperature", request.temperature(),
                "num_predict", request.maxTokens()
        ));

        JsonNode body = client.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        JsonNode text = body == null ? null : body.get("response");
        return new CompletionResponse(ProviderResponses.requireText(name(), text, "response"), name(), model, null);
    }
}

package com.github.dimitryivaniuta.agentgateway.agent.provider;

import com.github.dimitryivaniuta.agentgateway.agent.ProviderProperties;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import com.github.dimitryivaniuta.agentgateway.retry.UpstreamRetry;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.List;

@Component
public class OpenAiCompletionProvider extends OpenAiCompatibleProvider {

    private final boolean configured;

    public OpenAiCompletionProvider(ProviderProperties props, RestClient.Builder builder) {
        super(client(props.getOpenai(), builder), props.getOpenai().getModel());
        this.configured = StringUtils.hasText(props.getOpenai().getApiKey());
    }

    private static RestClient client(ProviderProperties.OpenAi openai, RestClient.Builder builder) {
        builder.baseUrl(openai.getBaseUrl());
        if (StringUtils.hasText(openai.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + openai.getApiKey());
        }
        return builder.build();
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public String notConfiguredMessage() {
        return "OpenAI API key not configured";
    }

    @Override
    public List<String> models() {
        return List.of("gpt-4", "gpt-4-turbo", "gpt-4o", "gpt-3.5-turbo");
    }

    @Override
    @UpstreamRetry(name = "openai.completion")
    public CompletionResponse complete(CompletionRequest request) {
        return chat(request);
    }
}

package com.github.dimitryivaniuta.agentgateway.agent.provider;

import com.github.dimitryivaniuta.agentgateway.agent.ProviderProperties;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import com.github.dimitryivaniuta.agentgateway.retry.UpstreamRetry;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * LM Studio's local server (OpenAI-compatible, no key).
 */
@Component
public class LmStudioCompletionProvider extends OpenAiCompatibleProvider {

    public LmStudioCompletionProvider(ProviderProperties props, RestClient.Builder builder) {
        super(builder.baseUrl(props.getLmStudio().getUrl()).build(), props.getLmStudio().getModel());
    }

    @Override
    public String name() {
        return "lmstudio";
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public List<String> models() {
        return List.of("local-model");
    }

    @Override
    public String note() {
        return "Requires LM Studio running on the host with the API server enabled";
    }

    @Override
    @UpstreamRetry(name = "lmstudio.completion")
    public CompletionResponse complete(CompletionRequest request) {
        return chat(request);
    }
}

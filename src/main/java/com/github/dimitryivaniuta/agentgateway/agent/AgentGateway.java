package com.github.dimitryivaniuta.agentgateway.agent;

import com.github.dimitryivaniuta.agentgateway.agent.dto.AgentInfo;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Routes completion requests to the provider named by {@link CompletionRequest#agent()}.
 *
 * <p>Credentials are checked before the provider is invoked, so a missing key fails immediately
 * instead of going through retry backoff. Provider failures that survive retries are rethrown as
 * {@link UpstreamFailureException}.
 */
@Slf4j
@Service
public class AgentGateway {

    private final Map<String, CompletionProvider> providers;
    private final GatewayMetrics metrics;

    public AgentGateway(List<CompletionProvider> providers, GatewayMetrics metrics) {
        Map<String, CompletionProvider> byName = new LinkedHashMap<>();
        for (CompletionProvider p : providers) {
            String name = p.name().toLowerCase(Locale.ROOT);
            if (byName.putIfAbsent(name, p) != null) {
                throw new IllegalStateException("Duplicate completion provider: " + name);
            }
        }
        this.providers = Collections.unmodifiableMap(byName);
        this.metrics = metrics;
        log.info("Completion providers: {}", this.providers.keySet());
    }

    public CompletionResponse complete(CompletionRequest request) {
        String agent = request.agent().toLowerCase(Locale.ROOT);
        CompletionProvider provider = providers.get(agent);
        if (provider == null) {
            throw new UnknownAgentException(request.agent());
        }
        if (!provider.isConfigured()) {
            throw new ProviderNotConfiguredException(agent, provider.notConfiguredMessage());
        }

        long start = System.nanoTime();
        String outcome = "error";
        try {
            CompletionResponse response = provider.complete(request);
            outcome = "success";
            return response;
        } catch (RestClientException ex) {
            log.warn("Completion via {} failed: {}", agent, ex.getMessage());
            throw UpstreamFailureException.from(agent, ex);
        } finally {
            metrics.recordCompletion(agent, outcome, System.nanoTime() - start);
        }
    }

    /**
     * Every registered provider with its availability and known models, in registration order.
     */
    public Map<String, AgentInfo> listAgents() {
        Map<String, AgentInfo> out = new LinkedHashMap<>();
        providers.forEach((name, p) -> out.put(name, new AgentInfo(p.isConfigured(), p.models(), p.note())));
        return out;
    }

}

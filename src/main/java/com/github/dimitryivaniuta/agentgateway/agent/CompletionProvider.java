package com.github.dimitryivaniuta.agentgateway.agent;

import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;

import java.util.List;

/**
 * One upstream completion backend, registered under {@link #name()}.
 */
public interface CompletionProvider {

    /**
     * Lowercase routing name, e.g. {@code openai}.
     */
    String name();

    /**
     * False when required credentials are missing; the gateway then fails fast without calling {@link #complete}.
     */
    boolean isConfigured();

    /**
     * Message returned to the caller when {@link #isConfigured()} is false.
     */
    default String notConfiguredMessage() {
        return name() + " API key not configured";
    }

    List<String> models();

    default String note() {
        return null;
    }

    CompletionResponse complete(CompletionRequest request);
}

package com.github.dimitryivaniuta.agentgateway.agent.dto;

import java.util.Map;

public record CompletionResponse(
        String content,
        String agent,
        String model,
        Map<String, Integer> usage
) {}

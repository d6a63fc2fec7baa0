package com.github.dimitryivaniuta.agentgateway.agent;

import com.github.dimitryivaniuta.agentgateway.agent.dto.AgentInfo;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AgentController {

    private final AgentGateway gateway;

    @PostMapping("/completion")
    public CompletionResponse completion(@Valid @RequestBody CompletionRequest request) {
        return gateway.complete(request);
    }

    @GetMapping("/agents")
    public Map<String, AgentInfo> agents() {
        return gateway.listAgents();
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "agent-gateway");
        body.put("status", "running");
        body.put("endpoints", List.of(
                "/health", "/healthz", "/healthz/{service}", "/health/live", "/health/ready",
                "/completion", "/agents", "/rate-limit/stats", "/metrics"
        ));
        return body;
    }
}

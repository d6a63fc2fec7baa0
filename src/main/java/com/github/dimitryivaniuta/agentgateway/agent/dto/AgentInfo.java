package com.github.dimitryivaniuta.agentgateway.agent.dto;

import java.util.List;

public record AgentInfo(boolean available, List<String> models, String note) {}

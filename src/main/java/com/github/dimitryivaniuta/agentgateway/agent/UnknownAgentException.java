package com.github.dimitryivaniuta.agentgateway.agent;

import org.springframework.http.HttpStatus;

public class UnknownAgentException extends GatewayException {

    public UnknownAgentException(String agent) {
        super(HttpStatus.BAD_REQUEST, "Unknown agent: " + agent);
    }
}

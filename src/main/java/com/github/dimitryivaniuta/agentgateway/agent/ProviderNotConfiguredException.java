package com.github.dimitryivaniuta.agentgateway.agent;

import org.springframework.http.HttpStatus;

/**
 * Provider lacks credentials. Raised before any network I/O, so it is never retried.
 */
public class ProviderNotConfiguredException extends GatewayException {

    private final String agent;

    public ProviderNotConfiguredException(String agent, String message) {
        super(HttpStatus.UNAUTHORIZED, message);
        this.agent = agent;
    }

    public String getAgent() {
        return agent;
    }
}

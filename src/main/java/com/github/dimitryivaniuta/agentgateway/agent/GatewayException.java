package com.github.dimitryivaniuta.agentgateway.agent;

import org.springframework.http.HttpStatus;

/**
 * Failure with a fixed HTTP mapping, rendered by the global exception handler.
 */
public abstract class GatewayException extends RuntimeException {

    private final HttpStatus status;

    protected GatewayException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected GatewayException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

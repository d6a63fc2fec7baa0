package com.github.dimitryivaniuta.agentgateway.agent;

import org.springframework.http.HttpStatus;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Upstream call failed for good. The underlying failure is kept as the cause.
 *
 * Status mapping:
 * - unreachable upstream or upstream 429: 503
 * - upstream 5xx or unusable response body: 502
 * - other upstream 4xx: the same status
 */
public class UpstreamFailureException extends GatewayException {

    private final String agent;

    public UpstreamFailureException(String agent, HttpStatus status, String message, Throwable cause) {
        super(status, message, cause);
        this.agent = agent;
    }

    public static UpstreamFailureException from(String agent, RuntimeException ex) {
        if (ex instanceof RestClientResponseException r) {
            int code = r.getStatusCode().value();
            if (code == 429) {
                return new UpstreamFailureException(agent, HttpStatus.SERVICE_UNAVAILABLE,
                        agent + " upstream is rate limiting requests (HTTP 429)", ex);
            }
            if (code >= 500) {
                return new UpstreamFailureException(agent, HttpStatus.BAD_GATEWAY,
                        agent + " upstream failed with HTTP " + code, ex);
            }
            HttpStatus same = HttpStatus.resolve(code);
            return new UpstreamFailureException(agent, same != null ? same : HttpStatus.BAD_GATEWAY,
                    agent + " upstream rejected the request with HTTP " + code, ex);
        }
        if (ex instanceof ResourceAccessException) {
            return new UpstreamFailureException(agent, HttpStatus.SERVICE_UNAVAILABLE,
                    agent + " upstream not reachable: " + ex.getMessage(), ex);
        }
        return new UpstreamFailureException(agent, HttpStatus.BAD_GATEWAY,
                agent + " upstream call failed: " + ex.getMessage(), ex);
    }

    public static UpstreamFailureException malformed(String agent, String detail) {
        return new UpstreamFailureException(agent, HttpStatus.BAD_GATEWAY,
                agent + " returned an unexpected response: " + detail, null);
    }

    public String getAgent() {
        return agent;
    }
}

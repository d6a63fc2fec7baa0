package com.github.dimitryivaniuta.agentgateway.ratelimit;

/**
 * The parts of an inbound request the limiter looks at.
 *
 * @param path     request path without query string
 * @param clientIp resolved client address, may be null
 * @param userId   authenticated user id, null for anonymous requests
 */
public record RateLimitRequest(String path, String clientIp, String userId) {

    public RateLimitRequest {
        if (path == null || path.isBlank()) path = "/";
    }

    /**
     * {@code user:<id>} when authenticated, otherwise {@code ip:<address>}.
     */
    public String defaultKey() {
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId;
        }
        return "ip:" + ((clientIp == null || clientIp.isBlank()) ? "unknown" : clientIp);
    }

    public String subjectType() {
        return (userId != null && !userId.isBlank()) ? "user" : "ip";
    }
}

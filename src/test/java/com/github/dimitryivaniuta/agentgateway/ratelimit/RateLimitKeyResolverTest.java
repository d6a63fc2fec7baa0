package com.github.dimitryivaniuta.agentgateway.ratelimit;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitKeyResolverTest {

    @Test
    void forwardedHeadersAreIgnoredUnlessTrusted() {
        MockHttpServletRequest req = request();

        RateLimitRequest r = new RateLimitKeyResolver(new RateLimitProperties()).resolve(req);

        assertThat(r.clientIp()).isEqualTo("10.0.0.1");
        assertThat(r.defaultKey()).isEqualTo("ip:10.0.0.1");
    }

    @Test
    void trustedForwardedForUsesFirstHop() {
        RateLimitProperties props = new RateLimitProperties();
        props.setTrustForwardedHeaders(true);

        RateLimitRequest r = new RateLimitKeyResolver(props).resolve(request());

        assertThat(r.clientIp()).isEqualTo("203.0.113.9");
    }

    @Test
    void principalTakesPrecedenceAndContextPathIsStripped() {
        MockHttpServletRequest req = request();
        req.setContextPath("/api");
        req.setRequestURI("/api/completion");
        req.setUserPrincipal(() -> "alice");

        RateLimitRequest r = new RateLimitKeyResolver(new RateLimitProperties()).resolve(req);

        assertThat(r.path()).isEqualTo("/completion");
        assertThat(r.defaultKey()).isEqualTo("user:alice");
        assertThat(r.subjectType()).isEqualTo("user");
    }

    private static MockHttpServletRequest request() {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/completion");
        req.setRemoteAddr("10.0.0.1");
        req.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");
        return req;
    }
}

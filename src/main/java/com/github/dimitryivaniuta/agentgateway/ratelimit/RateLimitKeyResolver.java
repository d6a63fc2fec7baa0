package com.github.dimitryivaniuta.agentgateway.ratelimit;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.security.Principal;

/**
 * Builds the limiter's view of a servlet request.
 *
 * Identity precedence:
 * - authenticated principal name (key "user:<name>")
 * - client address (key "ip:<address>")
 */
@Component
public class RateLimitKeyResolver {

    private final boolean trustForwardedHeaders;

    public RateLimitKeyResolver(RateLimitProperties props) {
        this.trustForwardedHeaders = props.isTrustForwardedHeaders();
    }

    public RateLimitRequest resolve(HttpServletRequest req) {
        String path = req.getRequestURI();
        String ctx = req.getContextPath();
        if (path != null && ctx != null && !ctx.isEmpty() && path.startsWith(ctx)) {
            path = path.substring(ctx.length());
        }

        Principal p = req.getUserPrincipal();
        String user = (p != null && p.getName() != null && !p.getName().isBlank()) ? p.getName() : null;

        return new RateLimitRequest(path, resolveClientIp(req), user);
    }

    private String resolveClientIp(HttpServletRequest req) {
        if (trustForwardedHeaders) {
            // X-Forwarded-For may contain "client, proxy1, proxy2"
            String xff = header(req, "X-Forwarded-For");
            if (xff != null) {
                int comma = xff.indexOf(',');
                String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
                if (!first.isBlank()) return first;
            }
            String realIp = header(req, "X-Real-IP");
            if (realIp != null) return realIp;
        }

        String ra = req.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? null : ra;
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}

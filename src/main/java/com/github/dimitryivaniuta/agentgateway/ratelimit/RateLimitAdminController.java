package com.github.dimitryivaniuta.agentgateway.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Operator view of the limiter. Only registered with {@code agent-gateway.rate-limit.admin.enabled=true}.
 */
@Slf4j
@RestController
@RequestMapping("/rate-limit")
@ConditionalOnProperty(prefix = "agent-gateway.rate-limit.admin", name = "enabled", havingValue = "true")
public class RateLimitAdminController {

    public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final RateLimiter rateLimiter;
    private final byte[] tokenDigest;

    public RateLimitAdminController(RateLimiter rateLimiter, RateLimitProperties props) {
        String token = props.getAdmin().getToken();
        if (!StringUtils.hasText(token)) {
            throw new IllegalStateException("agent-gateway.rate-limit.admin.token must be set when the admin endpoints are enabled");
        }
        this.rateLimiter = rateLimiter;
        this.tokenDigest = sha256(token);
    }

    @GetMapping("/stats")
    public RateLimitStats.Snapshot stats(@RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token) {
        requireAdmin(token);
        return rateLimiter.stats();
    }

    /**
     * Clears all strategy state of a key, e.g. {@code ip:10.0.0.7} or {@code completion:user:alice}.
     */
    @DeleteMapping("/keys/{key}")
    public ResponseEntity<Void> reset(@PathVariable String key,
                                      @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token) {
        requireAdmin(token);
        rateLimiter.reset(key);
        log.info("Rate limit state reset for {}", key);
        return ResponseEntity.noContent().build();
    }

    private void requireAdmin(String token) {
        if (!StringUtils.hasText(token)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Admin token required");
        }
        // constant time over equal-length digests
        if (!MessageDigest.isEqual(tokenDigest, sha256(token))) {
            log.warn("Rejected rate limit admin call with an invalid token");
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Invalid admin token");
        }
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

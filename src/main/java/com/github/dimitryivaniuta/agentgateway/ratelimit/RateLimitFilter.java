package com.github.dimitryivaniuta.agentgateway.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gates every request through the {@link RateLimiter}.
 *
 * <p>Rate limit headers are written on every response, exempt paths included. Denied requests get a 429 with a JSON body
 * and never reach the handler.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimiter rateLimiter;
    private final RateLimitKeyResolver keyResolver;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        RateLimitResult result = rateLimiter.check(keyResolver.resolve(request));
        result.toHeaders().forEach(response::setHeader);

        if (!result.allowed()) {
            writeTooManyRequests(response, result);
            return;
        }
        chain.doFilter(request, response);
    }

    private void writeTooManyRequests(HttpServletResponse response, RateLimitResult result) throws IOException {
        long waitSeconds = result.retryAfterHeaderSeconds();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Rate limit exceeded");
        body.put("retry_after", result.retryAfterSeconds());
        body.put("message", "Too many requests. Please wait " + waitSeconds + " seconds.");

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}

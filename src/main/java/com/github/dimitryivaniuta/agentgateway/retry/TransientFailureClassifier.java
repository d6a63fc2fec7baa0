package com.github.dimitryivaniuta.agentgateway.retry;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Decides whether an upstream failure is transient.
 *
 * Retryable:
 * - network failures: timeouts, refused or reset connections ({@link ResourceAccessException}, any {@link IOException})
 * - HTTP 429, 500, 502, 503, 504
 *
 * Everything else (other 4xx, parse errors, missing credentials) is permanent.
 */
public final class TransientFailureClassifier implements Predicate<Throwable> {

    public static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    public static final TransientFailureClassifier INSTANCE = new TransientFailureClassifier();

    private static final int MAX_CAUSE_DEPTH = 16;

    @Override
    public boolean test(Throwable ex) {
        Throwable t = ex;
        for (int depth = 0; t != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (t instanceof RestClientResponseException r) {
                return isRetryableStatus(r.getStatusCode().value());
            }
            if (t instanceof ResourceAccessException
                    || t instanceof IOException
                    || t instanceof TimeoutException) {
                return true;
            }
            if (t.getCause() == t) break;
            t = t.getCause();
        }
        return false;
    }

    public static boolean isRetryableStatus(int status) {
        return RETRYABLE_STATUS_CODES.contains(status);
    }
}

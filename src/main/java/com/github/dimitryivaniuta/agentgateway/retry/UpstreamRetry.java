package com.github.dimitryivaniuta.agentgateway.retry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Retries an upstream call on transient failures via {@link RetryMethodInterceptor}.
 *
 * Recommendations:
 * - Apply only to the method that performs the network call.
 * - Check credentials before calling the annotated method so misconfiguration never waits on backoff.
 *
 * Which failures are transient is fixed by {@link TransientFailureClassifier}.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface UpstreamRetry {

    /**
     * Name used in logs and metrics. Defaults to {@code SimpleClassName#method}.
     */
    String name() default "";

    /**
     * Total attempts including the initial call.
     */
    int maxAttempts() default 3;

    /**
     * Wait before the first retry; doubled for every further retry.
     */
    long minWaitMs() default 2_000;

    /**
     * Upper bound for a single wait.
     */
    long maxWaitMs() default 10_000;
}

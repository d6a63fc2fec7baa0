package com.github.dimitryivaniuta.agentgateway.retry;

import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public final class RetryMethodInterceptor implements MethodInterceptor {

    // one policy per target method; the annotation is fixed at compile time
    private final ConcurrentHashMap<Method, Optional<RetryPolicy>> policyCache = new ConcurrentHashMap<>();

    private final Supplier<GatewayMetrics> metrics;

    public RetryMethodInterceptor(Supplier<GatewayMetrics> metrics) {
        this.metrics = metrics;
    }

    @Override
    public Object invoke(MethodInvocation inv) throws Throwable {
        Class<?> targetClass = resolveTargetClass(inv);
        Method method = AopUtils.getMostSpecificMethod(inv.getMethod(), targetClass);

        Optional<RetryPolicy> policy = policyCache.computeIfAbsent(method, m -> buildPolicy(targetClass, m));
        if (policy.isEmpty()) return inv.proceed();

        return policy.get().execute(inv::proceed);
    }

    private Optional<RetryPolicy> buildPolicy(Class<?> targetClass, Method method) {
        UpstreamRetry ann = find(targetClass, method);
        if (ann == null) return Optional.empty();

        String name = ann.name().isBlank()
                ? targetClass.getSimpleName() + "#" + method.getName()
                : ann.name();

        RetryPolicy.Settings settings = new RetryPolicy.Settings(
                Math.max(1, ann.maxAttempts()),
                Duration.ofMillis(Math.max(1, ann.minWaitMs())),
                Duration.ofMillis(Math.max(Math.max(1, ann.minWaitMs()), ann.maxWaitMs()))
        );
        return Optional.of(RetryPolicy.forUpstream(name, settings, metrics.get()));
    }

    static UpstreamRetry find(Class<?> cls, Method m) {
        UpstreamRetry onMethod = AnnotatedElementUtils.findMergedAnnotation(m, UpstreamRetry.class);
        return (onMethod != null) ? onMethod : AnnotatedElementUtils.findMergedAnnotation(cls, UpstreamRetry.class);
    }

    private static Class<?> resolveTargetClass(MethodInvocation inv) {
        Object t = inv.getThis();
        Class<?> c = (t != null) ? AopUtils.getTargetClass(t) : null;
        return (c != null) ? c : inv.getMethod().getDeclaringClass();
    }
}

package com.github.dimitryivaniuta.agentgateway.retry;

import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import org.springframework.aop.framework.Advised;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;

/**
 * Wraps beans that carry {@link UpstreamRetry} in a runtime proxy (ProxyFactory) with a
 * {@link RetryMethodInterceptor}.
 *
 * <p>Not @Aspect-based. Beans exposing interfaces get a JDK proxy, others a class proxy.
 * Metrics are resolved lazily so the registry is not created during post-processor registration.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class UpstreamRetryBeanPostProcessor implements BeanPostProcessor {

    private final ObjectProvider<GatewayMetrics> metrics;

    public UpstreamRetryBeanPostProcessor(ObjectProvider<GatewayMetrics> metrics) {
        this.metrics = metrics;
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
        Class<?> targetClass = ClassUtils.getUserClass(bean);
        if (!needsProxy(targetClass)) return bean;

        var retry = new RetryMethodInterceptor(metrics::getObject);

        // already proxied (e.g. @Validated): retry goes innermost
        if (bean instanceof Advised advised) {
            advised.addAdvice(retry);
            return bean;
        }

        ProxyFactory pf = new ProxyFactory(bean);
        if (pf.getProxiedInterfaces().length == 0) {
            pf.setProxyTargetClass(true);
        }
        pf.addAdvice(retry);
        return pf.getProxy();
    }

    static boolean needsProxy(Class<?> targetClass) {
        if (AnnotatedElementUtils.hasAnnotation(targetClass, UpstreamRetry.class)) return true;
        for (Method m : targetClass.getMethods()) {
            if (AnnotatedElementUtils.hasAnnotation(m, UpstreamRetry.class)) return true;
        }
        return false;
    }
}

package com.github.dimitryivaniuta.agentgateway.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.agentgateway.health.probe.HttpHealthCheck;
import com.github.dimitryivaniuta.agentgateway.health.probe.PostgresHealthCheck;
import com.github.dimitryivaniuta.agentgateway.health.probe.RedisHealthCheck;
import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Health registry: postgres, redis, qdrant, langflow, n8n.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(HealthProperties.class)
public class HealthCheckConfiguration {

    @Bean(destroyMethod = "close")
    public HealthMonitor healthMonitor(HealthProperties props,
                                       ObjectMapper mapper,
                                       GatewayMetrics metrics,
                                       Clock clock) {
        SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout(props.getProbeTimeout());
        rf.setReadTimeout(props.getProbeTimeout());
        RestClient http = RestClient.builder().requestFactory(rf).build();

        List<ServiceHealthCheck> checks = List.of(
                new PostgresHealthCheck(props.getPostgres(), props.getProbeTimeout()),
                new RedisHealthCheck(props.getRedis(), props.getProbeTimeout()),
                new HttpHealthCheck("qdrant", "Qdrant", props.getQdrantUrl(), List.of("/healthz", "/health"), http, mapper),
                new HttpHealthCheck("langflow", "Langflow", props.getLangflowUrl(), List.of(), http, mapper),
                new HttpHealthCheck("n8n", "n8n", props.getN8nUrl(), List.of(), http, mapper)
        );

        HealthMonitor monitor = new HealthMonitor(checks, probeExecutor(), props.getCheckTimeout(), clock, metrics);
        List<String> unknown = props.getReadiness().stream()
                .filter(n -> !monitor.serviceNames().contains(n.toLowerCase(Locale.ROOT)))
                .toList();
        if (!unknown.isEmpty()) {
            monitor.close();
            throw new IllegalStateException("Unknown readiness services " + unknown
                    + "; registered: " + monitor.serviceNames());
        }
        log.info("Health checks registered: {} (readiness: {})", monitor.serviceNames(), props.getReadiness());
        return monitor;
    }

    // cached pool: a hung probe must not starve the others. Not a bean, so Boot keeps its applicationTaskExecutor.
    private static ExecutorService probeExecutor() {
        CustomizableThreadFactory tf = new CustomizableThreadFactory("health-check-");
        tf.setDaemon(true);
        return Executors.newCachedThreadPool(tf);
    }
}

package com.github.dimitryivaniuta.agentgateway.health.probe;

import com.github.dimitryivaniuta.agentgateway.health.HealthProperties;
import com.github.dimitryivaniuta.agentgateway.health.ServiceHealthCheck;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Sends {@code PING} over a short-lived Lettuce connection. The client (and its event loops) is
 * created on first use and shut down by {@link #close()}.
 */
public class RedisHealthCheck implements ServiceHealthCheck, AutoCloseable {

    private final RedisURI uri;
    private volatile RedisClient client;

    public RedisHealthCheck(HealthProperties.Redis redis, Duration timeout) {
        RedisURI.Builder b = RedisURI.builder()
                .withHost(redis.getHost())
                .withPort(redis.getPort())
                .withTimeout(timeout);
        if (StringUtils.hasText(redis.getPassword())) {
            b.withPassword(redis.getPassword().toCharArray());
        }
        this.uri = b.build();
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Outcome check() {
        try (StatefulRedisConnection<String, String> conn = client().connect()) {
            String pong = conn.sync().ping();
            return Outcome.up("Redis responded with " + pong);
        } catch (RedisException e) {
            return Outcome.down("Redis error: " + e.getMessage());
        }
    }

    private RedisClient client() {
        RedisClient c = client;
        if (c == null) {
            synchronized (this) {
                c = client;
                if (c == null) {
                    c = RedisClient.create(uri);
                    client = c;
                }
            }
        }
        return c;
    }

    @Override
    public void close() {
        RedisClient c = client;
        if (c != null) c.shutdown();
    }
}

package com.github.dimitryivaniuta.agentgateway.health;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "agent-gateway.health")
public class HealthProperties {

    /**
     * Connect/read timeout of each probe (SERVICE_HEALTH_TIMEOUT).
     */
    private Duration probeTimeout = Duration.ofSeconds(5);

    /**
     * Hard bound on one check as seen by the monitor, including pool scheduling.
     */
    private Duration checkTimeout = Duration.ofSeconds(10);

    /**
     * Services that gate {@code /health/ready}.
     */
    private List<String> readiness = new ArrayList<>(List.of("postgres", "redis"));

    private Postgres postgres = new Postgres();
    private Redis redis = new Redis();

    private String qdrantUrl = "http://qdrant:6333";
    // empty disables the probe
    private String langflowUrl = "http://langflow:7860";
    private String n8nUrl = "http://n8n:5678";

    @Getter
    @Setter
    public static class Postgres {
        private String host = "postgres";
        private int port = 5432;
        private String database = "postgres";
        private String user = "postgres";
        private String password = "postgres";
    }

    @Getter
    @Setter
    public static class Redis {
        private String host = "redis";
        private int port = 6379;
        private String password;
    }
}

package com.github.dimitryivaniuta.agentgateway.health.probe;

import com.github.dimitryivaniuta.agentgateway.health.HealthProperties;
import com.github.dimitryivaniuta.agentgateway.health.ServiceHealthCheck;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Properties;

/**
 * Opens a fresh JDBC connection and runs {@code SELECT 1}. No pool: a pooled connection would hide
 * a database that stopped accepting new sessions.
 */
public class PostgresHealthCheck implements ServiceHealthCheck {

    private final String url;
    private final Properties info;

    public PostgresHealthCheck(HealthProperties.Postgres pg, Duration timeout) {
        this.url = "jdbc:postgresql://" + pg.getHost() + ":" + pg.getPort() + "/" + pg.getDatabase();
        long seconds = Math.max(1, timeout.toSeconds());

        this.info = new Properties();
        info.setProperty("user", pg.getUser());
        if (pg.getPassword() != null) info.setProperty("password", pg.getPassword());
        info.setProperty("connectTimeout", String.valueOf(seconds));
        info.setProperty("socketTimeout", String.valueOf(seconds));
        info.setProperty("loginTimeout", String.valueOf(seconds));
        info.setProperty("ApplicationName", "agent-gateway-health");
    }

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public Outcome check() {
        try (Connection c = DriverManager.getConnection(url, info);
             Statement st = c.createStatement()) {
            st.execute("SELECT 1");
            return Outcome.up("PostgreSQL responded to SELECT 1");
        } catch (SQLException e) {
            return Outcome.down("PostgreSQL error: " + e.getMessage());
        }
    }
}

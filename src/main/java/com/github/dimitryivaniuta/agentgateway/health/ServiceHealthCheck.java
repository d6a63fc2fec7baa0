package com.github.dimitryivaniuta.agentgateway.health;

/**
 * Probe for one dependent service. Implementations report failures as a down {@link Outcome};
 * anything they throw is captured by {@link HealthMonitor}.
 */
public interface ServiceHealthCheck {

    /**
     * Registry name, lowercase.
     */
    String name();

    Outcome check();

    record Outcome(boolean ok, String detail) {

        public static Outcome up(String detail) {
            return new Outcome(true, detail);
        }

        public static Outcome down(String detail) {
            return new Outcome(false, detail);
        }
    }
}

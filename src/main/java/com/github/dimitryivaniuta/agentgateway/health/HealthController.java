package com.github.dimitryivaniuta.agentgateway.health;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency health. Aggregate endpoints answer 200 when every service is ok, 503 otherwise.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final HealthMonitor monitor;
    private final HealthProperties props;
    private final Clock clock;

    @GetMapping({"/health", "/healthz"})
    public ResponseEntity<HealthSummary> health() {
        HealthSummary summary = monitor.summary();
        return ResponseEntity.status(summary.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(summary);
    }

    @GetMapping("/healthz/{service}")
    public ResponseEntity<ServiceHealth> service(@PathVariable String service) {
        ServiceHealth result = monitor.serviceStatus(service)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown service: " + service));
        return ResponseEntity.status(result.ok() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(result);
    }

    @GetMapping("/health/live")
    public Map<String, Object> live() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "alive");
        body.put("uptime_seconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
        body.put("timestamp", clock.instant());
        return body;
    }

    @GetMapping("/health/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        HealthSummary summary = monitor.summary(props.getReadiness());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", summary.isHealthy() ? "ready" : "not_ready");
        body.put("timestamp", summary.timestamp());
        body.put("services", summary.services());
        return ResponseEntity.status(summary.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
    }
}

package com.github.dimitryivaniuta.agentgateway.health.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.agentgateway.health.ServiceHealthCheck;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

/**
 * HTTP GET probe. Ok on 200/204; a JSON {@code status} field in the body is appended to the detail.
 *
 * <p>With several paths the first ok one wins (e.g. {@code /healthz} then {@code /health}).
 * An empty base URL means the service is disabled, which counts as ok.
 */
@Slf4j
public class HttpHealthCheck implements ServiceHealthCheck {

    static final Set<Integer> OK_STATUSES = Set.of(200, 204);

    // only the status field is read; anything past this is dropped
    static final int MAX_BODY_BYTES = 64 * 1024;

    private final String name;
    private final String displayName;
    private final String baseUrl;
    private final List<String> paths;
    private final RestClient client;
    private final ObjectMapper mapper;

    public HttpHealthCheck(String name, String displayName, String baseUrl, List<String> paths,
                           RestClient client, ObjectMapper mapper) {
        this.name = name;
        this.displayName = displayName;
        this.baseUrl = baseUrl == null ? "" : baseUrl.strip();
        this.paths = paths.isEmpty() ? List.of("") : List.copyOf(paths);
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Outcome check() {
        if (!StringUtils.hasText(baseUrl)) {
            return Outcome.up(displayName + " disabled");
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;

        if (paths.size() == 1) {
            return get(base + paths.get(0));
        }

        Outcome last = null;
        for (String path : paths) {
            last = get(base + path);
            if (last.ok()) {
                return Outcome.up(displayName + " health endpoint reachable");
            }
        }
        return Outcome.down(displayName + " health check failed: " + last.detail());
    }

    private Outcome get(String url) {
        try {
            return client.get()
                    .uri(url)
                    .exchange((req, res) -> {
                        int code = res.getStatusCode().value();
                        String detail = "HTTP " + code;
                        String status = statusField(res.getHeaders().getContentType(), res.getBody().readNBytes(MAX_BODY_BYTES));
                        if (status != null) detail = detail + " (" + status + ")";
                        return new Outcome(OK_STATUSES.contains(code), detail);
                    });
        } catch (RestClientException e) {
            return Outcome.down(e.getMessage());
        }
    }

    private String statusField(MediaType type, byte[] body) throws IOException {
        if (body.length == 0 || type == null || !MediaType.APPLICATION_JSON.isCompatibleWith(type)) return null;
        try {
            JsonNode status = mapper.readTree(body).path("status");
            return status.isValueNode() && StringUtils.hasText(status.asText()) ? status.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("Health probe {} returned malformed JSON: {}", name, new String(body, StandardCharsets.UTF_8));
            return null;
        }
    }
}

package com.github.dimitryivaniuta.agentgateway.agent;

import com.github.dimitryivaniuta.agentgateway.agent.dto.AgentInfo;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.agentgateway.retry.RetryMethodInterceptor;
import com.github.dimitryivaniuta.agentgateway.retry.UpstreamRetry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentGatewayTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final GatewayMetrics metrics = new GatewayMetrics(registry);

    @Test
    void routesCaseInsensitively() {
        StubProvider openai = new StubProvider("openai", true);
        AgentGateway gateway = new AgentGateway(List.of(openai), metrics);

        CompletionResponse r = gateway.complete(CompletionRequest.of("hello", "OpenAI"));

        assertThat(r.content()).isEqualTo("echo: hello");
        assertThat(openai.calls).hasValue(1);
        assertThat(registry.get("agent_gateway_completion_duration_seconds")
                .tags("agent", "openai", "outcome", "success").timer().count()).isEqualTo(1);
    }

    @Test
    void unknownAgentIsBadRequest() {
        AgentGateway gateway = new AgentGateway(List.of(new StubProvider("openai", true)), metrics);

        assertThatThrownBy(() -> gateway.complete(CompletionRequest.of("hello", "copilot")))
                .isInstanceOfSatisfying(UnknownAgentException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(e.getMessage()).isEqualTo("Unknown agent: copilot");
                });
    }

    @Test
    void missingCredentialsFailFastWithoutRetryOrUpstreamCall() {
        StubProvider claude = new StubProvider("claude", false);
        CompletionProvider proxied = withRetry(claude);
        AgentGateway gateway = new AgentGateway(List.of(proxied), metrics);

        assertThatThrownBy(() -> gateway.complete(CompletionRequest.of("hello", "claude")))
                .isInstanceOfSatisfying(ProviderNotConfiguredException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    assertThat(e.getMessage()).isEqualTo("claude API key not configured");
                });
        assertThat(claude.calls).hasValue(0);
        assertThat(registry.find("agent_gateway_retry_calls_total").counter()).isNull();
    }

    @Test
    void transientUpstreamFailuresAreRetriedBehindTheProxy() {
        StubProvider openai = new StubProvider("openai", true);
        openai.failWith(() -> server(HttpStatus.SERVICE_UNAVAILABLE), () -> server(HttpStatus.BAD_GATEWAY));
        AgentGateway gateway = new AgentGateway(List.of(withRetry(openai)), metrics);

        CompletionResponse r = gateway.complete(CompletionRequest.of("hello", "openai"));

        assertThat(r.content()).isEqualTo("echo: hello");
        assertThat(openai.calls).hasValue(3);
    }

    @Test
    void exhaustedServerErrorsBecomeBadGatewayKeepingCause() {
        StubProvider openai = new StubProvider("openai", true);
        openai.failWith(() -> server(HttpStatus.INTERNAL_SERVER_ERROR),
                () -> server(HttpStatus.INTERNAL_SERVER_ERROR),
                () -> server(HttpStatus.INTERNAL_SERVER_ERROR));
        AgentGateway gateway = new AgentGateway(List.of(withRetry(openai)), metrics);

        assertThatThrownBy(() -> gateway.complete(CompletionRequest.of("hello", "openai")))
                .isInstanceOfSatisfying(UpstreamFailureException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
                    assertThat(e.getCause()).isInstanceOf(HttpServerErrorException.InternalServerError.class);
                });
        assertThat(openai.calls).hasValue(3);
        assertThat(registry.get("agent_gateway_completion_duration_seconds")
                .tags("agent", "openai", "outcome", "error").timer().count()).isEqualTo(1);
    }

    @Test
    void upstreamStatusMapping() {
        assertThat(statusFor(() -> HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "", null, null, null)))
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(statusFor(() -> new ResourceAccessException("I/O error", new ConnectException("refused"))))
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(statusFor(() -> HttpClientErrorException.create(HttpStatus.NOT_FOUND, "", null, null, null)))
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(statusFor(() -> server(HttpStatus.GATEWAY_TIMEOUT)))
                .isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void listsEveryProviderWithAvailability() {
        AgentGateway gateway = new AgentGateway(
                List.of(new StubProvider("openai", false), new StubProvider("ollama", true)), metrics);

        Map<String, AgentInfo> agents = gateway.listAgents();

        assertThat(agents.keySet()).containsExactly("openai", "ollama");
        assertThat(agents.get("openai").available()).isFalse();
        assertThat(agents.get("ollama").available()).isTrue();
        assertThat(agents.get("ollama").models()).containsExactly("stub-model");
    }

    @Test
    void duplicateProviderNamesAreRejected() {
        assertThatThrownBy(() -> new AgentGateway(
                List.of(new StubProvider("openai", true), new StubProvider("OPENAI", true)), metrics))
                .isInstanceOf(IllegalStateException.class);
    }

    private HttpStatus statusFor(Supplier<RuntimeException> failure) {
        StubProvider p = new StubProvider("openai", true);
        p.failWith(failure);
        AgentGateway gateway = new AgentGateway(List.of(p), metrics);
        try {
            gateway.complete(CompletionRequest.of("x", "openai"));
        } catch (UpstreamFailureException e) {
            return e.getStatus();
        }
        throw new AssertionError("expected an upstream failure");
    }

    private CompletionProvider withRetry(StubProvider target) {
        ProxyFactory pf = new ProxyFactory(target);
        pf.addAdvice(new RetryMethodInterceptor(() -> metrics));
        return (CompletionProvider) pf.getProxy();
    }

    private static HttpServerErrorException server(HttpStatus status) {
        return HttpServerErrorException.create(status, status.getReasonPhrase(), null, null, null);
    }

    static class StubProvider implements CompletionProvider {

        final AtomicInteger calls = new AtomicInteger();
        private final String name;
        private final boolean configured;
        private final Deque<Supplier<RuntimeException>> failures = new ArrayDeque<>();

        StubProvider(String name, boolean configured) {
            this.name = name;
            this.configured = configured;
        }

        @SafeVarargs
        final void failWith(Supplier<RuntimeException>... next) {
            failures.addAll(List.of(next));
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public List<String> models() {
            return List.of("stub-model");
        }

        @Override
        @UpstreamRetry(name = "stub.completion", minWaitMs = 1, maxWaitMs = 2)
        public CompletionResponse complete(CompletionRequest request) {
            calls.incrementAndGet();
            Supplier<RuntimeException> failure = failures.poll();
            if (failure != null) throw failure.get();
            return new CompletionResponse("echo: " + request.prompt(), name, "stub-model", null);
        }
    }
}

package com.github.dimitryivaniuta.agentgateway.agent.provider;

import com.github.dimitryivaniuta.agentgateway.agent.ProviderProperties;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionRequest;
import com.github.dimitryivaniuta.agentgateway.agent.dto.CompletionResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ClaudeCompletionProviderTest {

    @Test
    void callsMessagesApiWithKeyAndVersionHeaders() {
        ProviderProperties props = new ProviderProperties();
        props.getAnthropic().setApiKey("ant-key");
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();

        server.expect(requestTo("https://api.anthropic.com/v1/messages"))
                .andExpect(header("x-api-key", "ant-key"))
                .andExpect(header("anthropic-version", "2023-06-01"))
                .andExpect(jsonPath("$.model").value("claude-3-5-sonnet-20241022"))
                .andExpect(jsonPath("$.max_tokens").value(256))
                .andRespond(withSuccess("""
                        {"content":[{"type":"text","text":"Bonjour"}],
                         "usage":{"input_tokens":4,"output_tokens":1}}
                        """, MediaType.APPLICATION_JSON));

        ClaudeCompletionProvider provider = new ClaudeCompletionProvider(props, builder);
        CompletionResponse r = provider.complete(new CompletionRequest("Translate hello", "claude", null, 0.2, 256, null));

        assertThat(provider.isConfigured()).isTrue();
        assertThat(r.content()).isEqualTo("Bonjour");
        assertThat(r.model()).isEqualTo("claude-3-5-sonnet-20241022");
        assertThat(r.usage()).containsEntry("input_tokens", 4).containsEntry("output_tokens", 1);
        server.verify();
    }

    @Test
    void withoutKeyIsNotConfigured() {
        ClaudeCompletionProvider provider = new ClaudeCompletionProvider(new ProviderProperties(), RestClient.builder());

        assertThat(provider.isConfigured()).isFalse();
        assertThat(provider.notConfiguredMessage()).isEqualTo("Anthropic API key not configured");
    }
}

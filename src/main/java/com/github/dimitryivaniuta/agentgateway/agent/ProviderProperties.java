package com.github.dimitryivaniuta.agentgateway.agent;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "agent-gateway.providers")
public class ProviderProperties {

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(120);

    private OpenAi openai = new OpenAi();
    private Anthropic anthropic = new Anthropic();
    private Local lmStudio = new Local("http://host.docker.internal:1234/v1", "local-model");
    private Local ollama = new Local("http://ollama:11434", "llama3.2");

    @Getter
    @Setter
    public static class OpenAi {
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4";
    }

    @Getter
    @Setter
    public static class Anthropic {
        private String apiKey;
        private String baseUrl = "https://api.anthropic.com/v1";
        private String model = "claude-3-5-sonnet-20241022";
        private String apiVersion = "2023-06-01";
    }

    /**
     * Local model server, no credentials.
     */
    @Getter
    @Setter
    public static class Local {
        private String url;
        private String model;

        public Local() {
        }

        Local(String url, String model) {
            this.url = url;
            this.model = model;
        }
    }
}

package com.github.dimitryivaniuta.agentgateway.config;

import com.github.dimitryivaniuta.agentgateway.agent.ProviderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Timeouts for every {@code RestClient.Builder} handed out by Boot, which is how providers get theirs.
 * LLM completions are slow, hence the long read timeout.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class UpstreamHttpConfig {

    @Bean
    public RestClientCustomizer upstreamTimeouts(ProviderProperties props) {
        return builder -> {
            SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
            rf.setConnectTimeout(props.getConnectTimeout());
            rf.setReadTimeout(props.getReadTimeout());
            builder.requestFactory(rf);
        };
    }
}

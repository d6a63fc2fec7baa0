package com.github.dimitryivaniuta.agentgateway.config;

import java.util.List;

import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitResult;
import com.github.dimitryivaniuta.agentgateway.web.RequestContextKeys;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

@Configuration
public class CorsConfig {

    @Bean
    CorsConfigurationSource corsConfigurationSource(
            @Value("${agent-gateway.cors.allowed-origins:http://localhost:3000}") List<String> allowedOrigins) {
        CorsConfiguration c = new CorsConfiguration();
        c.setAllowedOrigins(allowedOrigins);
        c.setAllowedMethods(List.of("GET", "POST", "DELETE", "OPTIONS"));
        c.setAllowedHeaders(List.of(
                "Content-Type",
                "Authorization",
                RequestContextKeys.CORRELATION_ID_HEADER
        ));
        c.setExposedHeaders(List.of(
                RateLimitResult.HEADER_LIMIT,
                RateLimitResult.HEADER_REMAINING,
                RateLimitResult.HEADER_RESET,
                RateLimitResult.HEADER_RETRY_AFTER,
                RequestContextKeys.CORRELATION_ID_HEADER
        ));
        c.setAllowCredentials(false);
        c.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", c);
        return src;
    }

    // ahead of correlation id and rate limiting: preflights are answered without consuming quota.
    // mvcHandlerMappingIntrospector is a CorsConfigurationSource too.
    @Bean
    FilterRegistrationBean<CorsFilter> corsFilter(
            @Qualifier("corsConfigurationSource") CorsConfigurationSource source) {
        FilterRegistrationBean<CorsFilter> reg = new FilterRegistrationBean<>(new CorsFilter(source));
        reg.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return reg;
    }
}

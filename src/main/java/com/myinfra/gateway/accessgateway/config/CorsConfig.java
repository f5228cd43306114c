package com.myinfra.gateway.accessgateway.config;

import com.myinfra.gateway.accessgateway.config.AppConfig.CorsPolicyConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class CorsConfig {

    private static final long PREFLIGHT_MAX_AGE_SECONDS = 3600L;

    private final AppConfig appConfig;

    /**
     * Single-origin CORS policy for the admin front end, applied to the gateway's own
     * endpoints and to proxied paths alike.
     *
     * @return CorsWebFilter allowing {@code CORS_ORIGIN} with credentials
     */
    @Bean
    public CorsWebFilter corsWebFilter() {
        CorsPolicyConfig policy = appConfig.getCors();

        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOrigins(List.of(policy.getAllowedOrigin()));
        cors.setAllowedMethods(policy.getAllowedMethods());
        cors.setAllowedHeaders(policy.getAllowedHeaders());
        cors.setAllowCredentials(true);
        cors.setMaxAge(PREFLIGHT_MAX_AGE_SECONDS);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cors);

        return new CorsWebFilter(source);
    }
}

package com.myinfra.gateway.accessgateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "app")
@Validated
public class AppConfig {

    @Valid
    private GatewayConfig gatewayConfig = new GatewayConfig();

    @Valid
    private ProxyConfig proxy = new ProxyConfig();

    @Valid
    private RegistryConfig registry = new RegistryConfig();

    @Valid
    private RouteSourceConfig routing = new RouteSourceConfig();

    @Valid
    private CorsPolicyConfig cors = new CorsPolicyConfig();

    @Data
    public static class GatewayConfig {
        /**
         * Path predicate of the catch-all route whose requests are proxied.
         */
        @NotBlank
        private String routePrefix = "/api/**";

        @NotBlank
        private String serviceName = "api-gateway";

        @NotBlank
        private String version = "1.0.0";
    }

    @Data
    public static class ProxyConfig {
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(3);
    }

    @Data
    public static class RegistryConfig {
        @NotNull
        private Duration healthCheckInterval = Duration.ofSeconds(30);

        @NotNull
        private Duration healthCheckTimeout = Duration.ofSeconds(5);

        /**
         * Raw JSON array of legacy service descriptors. Blank means built-in legacy defaults.
         */
        private String servicesConfig;
    }

    @Data
    public static class RouteSourceConfig {
        /**
         * Explicit route mapping file. When set, failing to load it aborts startup.
         */
        private String configPath;

        @NotEmpty
        private List<String> defaultPaths = new ArrayList<>(List.of(
                "./config/route-mappings.json",
                "./route-mappings.json",
                "/etc/route-mappings.json"));

        @NotBlank
        private String environmentVariable = "ROUTE_MAPPING_CONFIG";
    }

    @Data
    public static class CorsPolicyConfig {
        @NotBlank
        private String allowedOrigin = "http://localhost:3000";

        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "PUT", "DELETE", "PATCH"));

        private List<String> allowedHeaders = new ArrayList<>(List.of("Content-Type", "Authorization", "x-tenant-id"));
    }
}

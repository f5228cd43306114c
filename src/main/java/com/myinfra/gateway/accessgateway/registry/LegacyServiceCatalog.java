package com.myinfra.gateway.accessgateway.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.accessgateway.config.route.EnvironmentInterpolator;
import com.myinfra.gateway.accessgateway.config.route.ServiceDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Secondary service list, registered after the route mapping services for names not already present.
 * Read from a raw JSON array when one is configured, otherwise built from per-service host and port
 * variables.
 */
@Slf4j
public class LegacyServiceCatalog {

    private static final TypeReference<List<ServiceDefinition>> DEFINITIONS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final EnvironmentInterpolator env;

    public LegacyServiceCatalog(ObjectMapper objectMapper, EnvironmentInterpolator env) {
        this.objectMapper = objectMapper;
        this.env = env;
    }

    /**
     * Returns the legacy definitions. A malformed JSON blob is logged and replaced by the defaults.
     *
     * @param servicesJson raw JSON array, may be blank
     */
    public List<ServiceDefinition> load(String servicesJson) {
        if (servicesJson == null || servicesJson.isBlank()) {
            return defaults();
        }
        try {
            List<ServiceDefinition> parsed = objectMapper.readValue(servicesJson, DEFINITIONS);
            return parsed == null ? defaults() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse SERVICES_CONFIG, using defaults: {}", e.getOriginalMessage());
            return defaults();
        }
    }

    List<ServiceDefinition> defaults() {
        return List.of(
                ServiceDefinition.builder()
                        .name("auth-service")
                        .host(env.lookup("AUTH_SERVICE_HOST", "localhost"))
                        .port(port("AUTH_SERVICE_PORT", 3200))
                        .health("/health")
                        .version(env.lookup("AUTH_SERVICE_VERSION", "1.0.0"))
                        .tags(List.of("auth", "jwt", "login"))
                        .routes(List.of("/api/auth"))
                        .build(),
                ServiceDefinition.builder()
                        .name("rbac-core")
                        .host(env.lookup("RBAC_CORE_HOST", "localhost"))
                        .port(port("RBAC_CORE_PORT", 3100))
                        .health("/health")
                        .version(env.lookup("RBAC_CORE_VERSION", "1.0.0"))
                        .tags(List.of("rbac", "tenants", "users", "roles"))
                        .routes(List.of("/api/tenants", "/api/users", "/api/roles",
                                "/api/policies", "/api/resources", "/api/authorization"))
                        .build(),
                ServiceDefinition.builder()
                        .name("audit-log-service")
                        .host(env.lookup("AUDIT_LOG_SERVICE_HOST", "localhost"))
                        .port(port("AUDIT_LOG_SERVICE_PORT", 3300))
                        .health("/health")
                        .version(env.lookup("AUDIT_LOG_SERVICE_VERSION", "1.0.0"))
                        .tags(List.of("audit", "logs", "monitoring"))
                        .routes(List.of("/api/audit"))
                        .build());
    }

    private int port(String variable, int defaultPort) {
        String value = env.lookup(variable, null);
        if (value == null) {
            return defaultPort;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}='{}', using {}", variable, value, defaultPort);
            return defaultPort;
        }
    }
}

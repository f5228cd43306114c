package com.myinfra.gateway.accessgateway.model;

import java.util.List;
import java.util.Set;

/**
 * A backend service known to the registry.
 *
 * @param name       Unique registry key (e.g., "auth-service")
 * @param host       Host the backend listens on
 * @param port       Port the backend listens on
 * @param healthPath Path polled by health checks (e.g., "/health")
 * @param version    Advertised version
 * @param tags       Free-form labels
 * @param routes     Informational path prefixes served by the backend; not used for matching
 */
public record ServiceDescriptor(
        String name,
        String host,
        int port,
        String healthPath,
        String version,
        Set<String> tags,
        List<String> routes) {

    public static final String DEFAULT_HEALTH_PATH = "/health";
    public static final String DEFAULT_VERSION = "1.0.0";

    public ServiceDescriptor {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        routes = routes == null ? List.of() : List.copyOf(routes);
        healthPath = healthPath == null || healthPath.isBlank() ? DEFAULT_HEALTH_PATH : healthPath;
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
    }

    public static ServiceDescriptor of(String name, AddressSpec address, String healthPath,
                                       String version, Set<String> tags, List<String> routes) {
        return new ServiceDescriptor(name, address.host(), address.port(), healthPath, version, tags, routes);
    }

    public String baseUrl() {
        return "http://" + host + ":" + port;
    }
}

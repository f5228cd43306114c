package com.myinfra.gateway.accessgateway.config.route;

import com.myinfra.gateway.accessgateway.config.route.RouteMappingConfiguration.GlobalSettings;
import com.myinfra.gateway.accessgateway.routing.PatternKind;

import java.util.List;

/**
 * Built-in configuration used when no file or environment document is available:
 * the auth, RBAC core and audit log backends with one route family each.
 */
final class DefaultRouteMappings {

    static final String VERSION = "1.0.0";

    private static final List<String> ALL_METHODS = List.of("GET", "POST", "PUT", "DELETE");

    private DefaultRouteMappings() {
    }

    static RouteMappingConfiguration create(EnvironmentInterpolator env) {
        return RouteMappingConfiguration.builder()
                .version(VERSION)
                .services(services(env))
                .routeMappings(routeMappings())
                .globalSettings(GlobalSettings.builder()
                        .defaultTimeout(5000L)
                        .defaultRetries(3)
                        .enableHealthChecks(true)
                        .build())
                .build();
    }

    private static List<ServiceDefinition> services(EnvironmentInterpolator env) {
        String environment = env.lookup("NODE_ENV", "development");
        return List.of(
                service(env, "auth-service", "Authentication Service", "AUTH_SERVICE_URL",
                        "AUTH_SERVICE_HOST", "AUTH_SERVICE_PORT", "3001", List.of("auth", "security"), environment),
                service(env, "rbac-core", "RBAC Core Service", "RBAC_SERVICE_URL",
                        "RBAC_SERVICE_HOST", "RBAC_CORE_PORT", "3100", List.of("rbac", "authorization"), environment),
                service(env, "audit-log-service", "Audit Log Service", "AUDIT_SERVICE_URL",
                        "AUDIT_SERVICE_HOST", "AUDIT_LOG_SERVICE_PORT", "3300", List.of("audit", "logging"), environment));
    }

    private static ServiceDefinition service(EnvironmentInterpolator env, String id, String name, String urlVar,
                                             String hostVar, String portVar, String defaultPort,
                                             List<String> tags, String environment) {
        String host = env.lookup(hostVar, "localhost");
        String port = env.lookup(portVar, defaultPort);
        return ServiceDefinition.builder()
                .id(id)
                .name(name)
                .version(VERSION)
                .baseUrl(env.lookup(urlVar, "http://" + host + ":" + port))
                .healthCheck("/health")
                .timeout(5000L)
                .retries(3)
                .tags(tags)
                .environment(environment)
                .build();
    }

    private static List<RouteMappingDefinition> routeMappings() {
        return List.of(
                mapping("auth-routes", "/api/auth/.*", "auth-service", 100, ALL_METHODS,
                        "Authentication and user management routes"),
                mapping("rbac-routes", "/api/rbac/.*", "rbac-core", 90, ALL_METHODS,
                        "Role-based access control routes"),
                mapping("audit-routes", "/api/audit/.*", "audit-log-service", 80, List.of("GET", "POST"),
                        "Audit logging and retrieval routes"));
    }

    private static RouteMappingDefinition mapping(String id, String pattern, String service, int priority,
                                                  List<String> methods, String description) {
        return RouteMappingDefinition.builder()
                .id(id)
                .pattern(pattern)
                .patternType(PatternKind.REGEX)
                .service(service)
                .priority(priority)
                .methods(methods)
                .description(description)
                .build();
    }
}

package com.myinfra.gateway.accessgateway.controller;

import com.myinfra.gateway.accessgateway.config.AppConfig;
import com.myinfra.gateway.accessgateway.model.ServiceDescriptor;
import com.myinfra.gateway.accessgateway.registry.ServiceRegistry;
import com.myinfra.gateway.accessgateway.routing.RouteMapping;
import com.myinfra.gateway.accessgateway.routing.RouteResolver;
import com.myinfra.gateway.accessgateway.service.ServiceDocsAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway's own endpoints: liveness, registry contents and routing tables.
 */
@RestController
@RequiredArgsConstructor
public class GatewayController {

    private final ServiceRegistry serviceRegistry;
    private final RouteResolver routeResolver;
    private final ServiceDocsAggregator docsAggregator;
    private final AppConfig appConfig;

    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now().toString());
        body.put("service", appConfig.getGatewayConfig().getServiceName());
        return Mono.just(body);
    }

    @GetMapping("/services")
    public Mono<Map<String, Object>> services() {
        List<ServiceDescriptor> services = serviceRegistry.getAllServices();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("services", services);
        body.put("count", services.size());
        return Mono.just(body);
    }

    @GetMapping("/services/{serviceName}/health")
    public Mono<Map<String, Object>> serviceHealth(@PathVariable String serviceName) {
        return serviceRegistry.healthCheck(serviceName)
                .map(healthy -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("service", serviceName);
                    body.put("healthy", healthy);
                    body.put("info", serviceRegistry.discover(serviceName).orElse(null));
                    body.put("timestamp", Instant.now().toString());
                    return body;
                });
    }

    @GetMapping("/docs")
    public Mono<Map<String, Object>> docs() {
        return docsAggregator.collect()
                .map(docs -> {
                    Map<String, Object> gateway = new LinkedHashMap<>();
                    gateway.put("name", appConfig.getGatewayConfig().getServiceName());
                    gateway.put("version", appConfig.getGatewayConfig().getVersion());
                    gateway.put("timestamp", Instant.now().toString());

                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("gateway", gateway);
                    body.put("services", docs);
                    return body;
                });
    }

    /**
     * Informational route table built from the path prefixes services advertise.
     * Request routing uses the route mappings, not this table.
     */
    @GetMapping("/routes")
    public Mono<Map<String, Object>> routes() {
        Map<String, Object> routes = new LinkedHashMap<>();
        for (ServiceDescriptor service : serviceRegistry.getAllServices()) {
            for (String route : service.routes()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("service", service.name());
                entry.put("target", service.host() + ":" + service.port());
                entry.put("health", service.healthPath());
                entry.put("tags", service.tags());
                routes.put(route, entry);
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("routes", routes);
        body.put("totalRoutes", routes.size());
        return Mono.just(body);
    }

    @GetMapping("/route-mappings")
    public Mono<List<Map<String, Object>>> routeMappings() {
        return Mono.just(routeResolver.getMappings().stream()
                .map(GatewayController::describe)
                .toList());
    }

    private static Map<String, Object> describe(RouteMapping mapping) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", mapping.id());
        entry.put("pattern", mapping.pattern().pattern());
        entry.put("service", mapping.serviceName());
        entry.put("transformations", mapping.transformation());
        entry.put("priority", mapping.priority());
        return entry;
    }
}

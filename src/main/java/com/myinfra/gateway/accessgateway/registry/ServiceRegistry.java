package com.myinfra.gateway.accessgateway.registry;

import com.myinfra.gateway.accessgateway.config.AppConfig;
import com.myinfra.gateway.accessgateway.config.AppConfig.RegistryConfig;
import com.myinfra.gateway.accessgateway.config.route.RouteMappingConfiguration;
import com.myinfra.gateway.accessgateway.config.route.ServiceDefinition;
import com.myinfra.gateway.accessgateway.model.ServiceDescriptor;
import com.myinfra.gateway.accessgateway.routing.RouteMapping;
import com.myinfra.gateway.accessgateway.routing.RouteResolver;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory directory of backend services.
 * <p>
 * Entries are keyed by name and replaced wholesale on re-registration. Health checks run on a
 * recurring sweep and are observational only: an unhealthy service stays registered and routable.
 */
@Slf4j
@Service
public class ServiceRegistry {

    private final Map<String, ServiceDescriptor> services = new ConcurrentHashMap<>();

    private final RouteResolver routeResolver;
    private final RouteMappingConfiguration routeConfig;
    private final LegacyServiceCatalog legacyCatalog;
    private final RegistryConfig registryConfig;
    private final WebClient webClient;

    private volatile Disposable healthCheckTask;

    public ServiceRegistry(RouteResolver routeResolver,
                           RouteMappingConfiguration routeConfig,
                           LegacyServiceCatalog legacyCatalog,
                           AppConfig appConfig,
                           WebClient.Builder webClientBuilder) {
        this.routeResolver = Objects.requireNonNull(routeResolver, "RouteResolver must not be null");
        this.routeConfig = Objects.requireNonNull(routeConfig, "RouteMappingConfiguration must not be null");
        this.legacyCatalog = Objects.requireNonNull(legacyCatalog, "LegacyServiceCatalog must not be null");
        this.registryConfig = Objects.requireNonNull(appConfig, "AppConfig must not be null").getRegistry();
        Objects.requireNonNull(webClientBuilder, "WebClient.Builder must not be null");

        Duration timeout = registryConfig.getHealthCheckTimeout();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .responseTimeout(timeout);

        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    /**
     * Registers the configured and legacy services, then starts the health check sweep.
     *
     * @throws com.myinfra.gateway.accessgateway.exception.GatewayConfigurationException if a service has no usable address
     */
    @PostConstruct
    public void start() {
        registerKnownServices();

        if (routeConfig.healthChecksEnabled()) {
            startHealthChecks();
        } else {
            log.info("Health checks disabled by global settings");
        }
    }

    /**
     * Cancels the health check sweep. Registered services are kept.
     */
    @PreDestroy
    public void shutdown() {
        Disposable task = healthCheckTask;
        if (task != null && !task.isDisposed()) {
            task.dispose();
            log.info("Health check sweep stopped");
        }
        healthCheckTask = null;
    }

    public boolean isHealthCheckRunning() {
        Disposable task = healthCheckTask;
        return task != null && !task.isDisposed();
    }

    public void register(ServiceDescriptor service) {
        Objects.requireNonNull(service, "service must not be null");
        services.put(service.name(), service);
        log.info("Service registered: {} at {}:{}", service.name(), service.host(), service.port());
    }

    public void unregister(String serviceName) {
        if (serviceName != null) {
            services.remove(serviceName);
        }
        log.info("Service unregistered: {}", serviceName);
    }

    public Optional<ServiceDescriptor> discover(String serviceName) {
        return serviceName == null ? Optional.empty() : Optional.ofNullable(services.get(serviceName));
    }

    /**
     * Finds the service for a request path through the first matching route mapping.
     *
     * @param path Full request path including the query string
     * @return the service, or empty when no mapping matches or the mapped service is not registered
     */
    public Optional<ServiceDescriptor> discoverByRoute(String path) {
        return resolveRoute(path).map(RouteTarget::service);
    }

    /**
     * Like {@link #discoverByRoute(String)}, also returning the mapping that matched.
     * An unmapped path is logged as a warning; a mapping to an unknown service as an error.
     */
    public Optional<RouteTarget> resolveRoute(String path) {
        Optional<RouteMapping> mapping = routeResolver.findMapping(path);
        if (mapping.isEmpty()) {
            log.warn("No service mapping found for route: {}", path);
            return Optional.empty();
        }

        String serviceName = mapping.get().serviceName();
        ServiceDescriptor service = services.get(serviceName);
        if (service == null) {
            log.error("Service not found: {} for route: {}", serviceName, path);
            return Optional.empty();
        }

        return Optional.of(new RouteTarget(service, mapping.get()));
    }

    public List<ServiceDescriptor> getAllServices() {
        return List.copyOf(services.values());
    }

    /**
     * Polls the service's health path.
     *
     * @param serviceName Registered service name
     * @return Mono emitting true only for an HTTP 200 answer; false for anything else, never an error
     */
    public Mono<Boolean> healthCheck(String serviceName) {
        ServiceDescriptor service = serviceName == null ? null : services.get(serviceName);
        if (service == null) {
            return Mono.just(false);
        }

        return Mono.defer(() -> webClient.get()
                        .uri(healthUri(service))
                        .exchangeToMono(response -> response.releaseBody()
                                .thenReturn(response.statusCode().value() == 200)))
                .timeout(registryConfig.getHealthCheckTimeout())
                .onErrorResume(e -> {
                    log.warn("Health check failed for {}: {}", serviceName, e.toString());
                    return Mono.just(false);
                });
    }

    private void registerKnownServices() {
        log.info("Registering services from route configuration...");
        log.info("Found {} services in configuration", routeConfig.getServices().size());

        for (ServiceDefinition definition : routeConfig.getServices()) {
            if (isNameless(definition)) {
                continue;
            }
            register(definition.toDescriptor());
        }

        for (ServiceDefinition definition : legacyCatalog.load(registryConfig.getServicesConfig())) {
            if (isNameless(definition)) {
                continue;
            }
            ServiceDescriptor legacy = definition.toDescriptor();
            if (!services.containsKey(legacy.name())) {
                register(legacy);
            }
        }
    }

    private static boolean isNameless(ServiceDefinition definition) {
        if (definition == null) {
            log.error("Skipping empty service definition");
            return true;
        }
        String name = definition.registryName();
        if (name == null || name.isBlank()) {
            log.error("Service configuration missing id or name, skipping: {}", definition);
            return true;
        }
        return false;
    }

    private void startHealthChecks() {
        Duration interval = registryConfig.getHealthCheckInterval();
        healthCheckTask = Flux.interval(interval, interval)
                .onBackpressureDrop()
                .concatMap(tick -> performHealthChecks())
                .subscribe();
        log.info("Health check sweep started every {} ms", interval.toMillis());
    }

    Mono<Void> performHealthChecks() {
        return Flux.fromIterable(getAllServices())
                .flatMap(service -> healthCheck(service.name())
                        .doOnNext(healthy -> {
                            if (!healthy) {
                                log.error("Service {} is unhealthy", service.name());
                            }
                        }))
                .then()
                .onErrorResume(e -> {
                    log.error("Health check sweep failed", e);
                    return Mono.empty();
                });
    }

    private static URI healthUri(ServiceDescriptor service) {
        String path = service.healthPath();
        return URI.create(service.baseUrl() + (path.startsWith("/") ? path : "/" + path));
    }
}

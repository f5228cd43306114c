package com.myinfra.gateway.accessgateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.myinfra.gateway.accessgateway.config.AppConfig;
import com.myinfra.gateway.accessgateway.model.ServiceDescriptor;
import com.myinfra.gateway.accessgateway.registry.ServiceRegistry;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects the OpenAPI documents published by registered backends.
 */
@Slf4j
@Service
public class ServiceDocsAggregator {

    static final String DOCS_PATH = "/docs-json";

    private final ServiceRegistry serviceRegistry;
    private final WebClient webClient;
    private final Duration timeout;

    public ServiceDocsAggregator(WebClient.Builder webClientBuilder,
                                 ServiceRegistry serviceRegistry,
                                 AppConfig appConfig) {
        this.serviceRegistry = Objects.requireNonNull(serviceRegistry, "ServiceRegistry must not be null");
        this.timeout = appConfig.getRegistry().getHealthCheckTimeout();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .responseTimeout(timeout);

        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    /**
     * Fetches every registered service's document concurrently, in registry snapshot order.
     * Services that are down, slow or answer non-2xx are left out.
     *
     * @return one entry per service that answered: service, version, routes, swagger
     */
    public Mono<List<Map<String, Object>>> collect() {
        return Flux.fromIterable(serviceRegistry.getAllServices())
                .flatMapSequential(this::fetch)
                .collectList();
    }

    private Mono<Map<String, Object>> fetch(ServiceDescriptor service) {
        return webClient.get()
                .uri(URI.create(service.baseUrl() + DOCS_PATH))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .map(swagger -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("service", service.name());
                    entry.put("version", service.version());
                    entry.put("routes", service.routes());
                    entry.put("swagger", swagger);
                    return entry;
                })
                .onErrorResume(e -> {
                    log.warn("Could not fetch docs for {}: {}", service.name(), e.getMessage());
                    return Mono.empty();
                });
    }
}

package com.myinfra.gateway.accessgateway.service;

import com.myinfra.gateway.accessgateway.config.AppConfig;
import com.myinfra.gateway.accessgateway.config.AppConfig.ProxyConfig;
import com.myinfra.gateway.accessgateway.exception.ErrorResponseWriter;
import com.myinfra.gateway.accessgateway.model.ServiceDescriptor;
import com.myinfra.gateway.accessgateway.registry.RouteTarget;
import com.myinfra.gateway.accessgateway.registry.ServiceRegistry;
import com.myinfra.gateway.accessgateway.routing.RouteResolver;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
public class ProxyService {

    static final Set<String> REQUEST_HOP_BY_HOP_HEADERS = Set.of(
            "host",
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailers",
            "transfer-encoding",
            "upgrade",
            "content-length");

    static final Set<String> RESPONSE_HOP_BY_HOP_HEADERS = Set.of(
            "host",
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailers",
            "transfer-encoding",
            "upgrade");

    private final WebClient webClient;
    private final ServiceRegistry serviceRegistry;
    private final RouteResolver routeResolver;
    private final ErrorResponseWriter errorResponseWriter;
    private final ProxyConfig proxyConfig;

    public ProxyService(WebClient.Builder webClientBuilder,
                        ServiceRegistry serviceRegistry,
                        RouteResolver routeResolver,
                        ErrorResponseWriter errorResponseWriter,
                        AppConfig appConfig) {
        Objects.requireNonNull(webClientBuilder, "WebClient.Builder must not be null");
        this.serviceRegistry = Objects.requireNonNull(serviceRegistry, "ServiceRegistry must not be null");
        this.routeResolver = Objects.requireNonNull(routeResolver, "RouteResolver must not be null");
        this.errorResponseWriter = Objects.requireNonNull(errorResponseWriter, "ErrorResponseWriter must not be null");
        this.proxyConfig = Objects.requireNonNull(appConfig, "AppConfig must not be null").getProxy();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) proxyConfig.getConnectTimeout().toMillis())
                .responseTimeout(proxyConfig.getRequestTimeout());

        ClientHttpConnector connector = new ReactorClientHttpConnector(httpClient);

        this.webClient = webClientBuilder
                .clientConnector(connector)
                .build();
    }

    /**
     * Forwards the incoming request to the backend selected by the route mappings.
     * <p>
     * Backend responses are relayed with their own status whatever it is. The gateway only answers
     * itself when no backend is mapped (404) or none could be reached (503, 504 or 502).
     *
     * @param exchange Current HTTP exchange (request + response)
     * @return Mono<Void> completing when the response has been written to the client
     */
    public Mono<Void> forward(ServerWebExchange exchange) {
        Objects.requireNonNull(exchange, "exchange must not be null");

        ServerHttpRequest request = exchange.getRequest();
        ServerHttpResponse response = exchange.getResponse();

        String rawQuery = request.getURI().getRawQuery();
        String originalPath = request.getURI().getRawPath() + (rawQuery != null ? "?" + rawQuery : "");
        HttpMethod method = request.getMethod() != null ? request.getMethod() : HttpMethod.GET;

        log.debug("Proxying {} {}", method, originalPath);

        Optional<RouteTarget> target = serviceRegistry.resolveRoute(originalPath);
        if (target.isEmpty()) {
            return errorResponseWriter.write(response, HttpStatus.NOT_FOUND, "Service not found");
        }

        ServiceDescriptor service = target.get().service();
        String targetPath = target.get().mapping() != null
                ? routeResolver.transform(originalPath, target.get().mapping())
                : originalPath;

        URI targetUri;
        try {
            targetUri = buildTargetUri(service, targetPath, rawQuery);
        } catch (IllegalArgumentException e) {
            log.error("Invalid target URI for {} {}: {}", method, originalPath, e.getMessage());
            return errorResponseWriter.write(response, HttpStatus.INTERNAL_SERVER_ERROR, "Invalid target URI");
        }

        log.debug("Forwarding to: {}", targetUri);

        HttpHeaders outboundHeaders = filterHeaders(request.getHeaders(), REQUEST_HOP_BY_HOP_HEADERS);

        WebClient.RequestBodySpec spec = webClient
                .method(method)
                .uri(targetUri)
                .headers(h -> h.addAll(outboundHeaders));

        WebClient.RequestHeadersSpec<?> call = hasBody(request)
                ? spec.body(BodyInserters.fromDataBuffers(request.getBody()))
                : spec;

        Set<String> relayedHeaders = new HashSet<>();

        return call.exchangeToMono(backendResponse -> {
                    response.setStatusCode(backendResponse.statusCode());
                    HttpHeaders backendHeaders = filterHeaders(
                            backendResponse.headers().asHttpHeaders(), RESPONSE_HOP_BY_HOP_HEADERS);
                    backendHeaders.forEach((name, values) -> {
                        response.getHeaders().put(name, values);
                        relayedHeaders.add(name);
                    });
                    return response.writeWith(backendResponse.bodyToFlux(DataBuffer.class));
                })
                .timeout(proxyConfig.getRequestTimeout())
                .onErrorResume(throwable -> resumeWithTransportFailure(
                        response, relayedHeaders, method, originalPath, throwable));
    }

    /**
     * Writes the error envelope for a request that got no backend response.
     *
     * @param response       ServerHttpResponse to write the error to
     * @param relayedHeaders Names of backend headers already copied onto the response
     * @param method         Original request method, for logging
     * @param path           Original request path, for logging
     * @param t              The throwable that ended the backend call
     * @return Mono<Void> completing when the error response is written
     */
    private Mono<Void> resumeWithTransportFailure(ServerHttpResponse response, Set<String> relayedHeaders,
                                                  HttpMethod method, String path, Throwable t) {
        TransportFailure failure = TransportFailure.classify(t);
        log.error("Proxy error for {} {}: {} ({})", method, path, t.getMessage(), failure.status().value());

        if (response.isCommitted()) {
            return Mono.error(t);
        }

        // Gateway headers (CORS, correlation id) stay; only what the backend contributed goes.
        relayedHeaders.forEach(response.getHeaders()::remove);
        return errorResponseWriter.write(response, failure.status(), failure.message());
    }

    /**
     * Builds {@code http://host:port{path}}. The original query string is carried over
     * when the transformed path no longer has one.
     *
     * @param service  Target backend
     * @param path     Transformed path, possibly with a query string
     * @param rawQuery Original raw query string, may be null
     * @return the absolute backend URI
     */
    static URI buildTargetUri(ServiceDescriptor service, String path, String rawQuery) {
        StringBuilder sb = new StringBuilder(service.baseUrl());
        if (!path.startsWith("/")) {
            sb.append('/');
        }
        sb.append(path);
        if (rawQuery != null && !rawQuery.isEmpty() && !path.contains("?")) {
            sb.append('?').append(rawQuery);
        }
        return URI.create(sb.toString());
    }

    /**
     * Copies every header except the excluded ones, keeping names and values as received.
     *
     * @param source   Headers to copy
     * @param excluded Lower-case names to drop
     * @return the filtered copy
     */
    static HttpHeaders filterHeaders(HttpHeaders source, Set<String> excluded) {
        HttpHeaders filtered = new HttpHeaders();
        source.forEach((key, values) -> {
            if (key == null || values == null) return;
            if (!excluded.contains(key.toLowerCase(Locale.ROOT))) {
                filtered.addAll(key, values);
            }
        });
        return filtered;
    }

    private static boolean hasBody(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        return headers.getContentLength() > 0 || headers.containsKey(HttpHeaders.TRANSFER_ENCODING);
    }
}

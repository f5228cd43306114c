package com.myinfra.gateway.accessgateway.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Logs each proxied request and its outcome, tagging both with a correlation id
 * that is also forwarded to the backend.
 */
@Slf4j
@Component
public class RequestLoggingFilter implements GlobalFilter, Ordered {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    private static final String REQUEST_TIME_ATTR = "requestTime";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();

        String correlationId = request.getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isEmpty()) {
            correlationId = UUID.randomUUID().toString();
        }

        exchange.getAttributes().put(REQUEST_TIME_ATTR, Instant.now());

        String finalCorrelationId = correlationId;
        ServerHttpRequest modifiedRequest = request.mutate()
                .headers(h -> h.set(CORRELATION_ID_HEADER, finalCorrelationId))
                .build();
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        log.info("Incoming request: {} {} - CorrelationId: {} - Client: {}",
                request.getMethod(),
                request.getURI().getRawPath(),
                correlationId,
                getClientInfo(exchange));

        return chain.filter(exchange.mutate().request(modifiedRequest).build())
                .doFinally(signal -> {
                    Instant requestTime = exchange.getAttribute(REQUEST_TIME_ATTR);
                    long duration = requestTime != null
                            ? Instant.now().toEpochMilli() - requestTime.toEpochMilli() : 0;

                    log.info("Outgoing response: {} {} - Status: {} - Duration: {}ms - CorrelationId: {}",
                            request.getMethod(),
                            request.getURI().getRawPath(),
                            exchange.getResponse().getStatusCode(),
                            duration,
                            finalCorrelationId);
                });
    }

    private String getClientInfo(ServerWebExchange exchange) {
        String forwardedFor = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return forwardedFor.split(",")[0].trim();
        }

        var remoteAddress = exchange.getRequest().getRemoteAddress();
        return remoteAddress != null ? remoteAddress.toString() : "unknown";
    }

    @Override
    public int getOrder() {
        return -3;
    }
}

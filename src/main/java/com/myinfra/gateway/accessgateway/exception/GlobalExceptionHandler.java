package com.myinfra.gateway.accessgateway.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Global Exception Handler for the gateway.
 * Catches whatever escapes a handler or filter so the client always receives the
 * standard JSON error envelope instead of a default error page.
 */
@Slf4j
@Component
@Order(-2) // Runs before Spring Boot's DefaultErrorWebExceptionHandler (Order -1)
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    private final ErrorResponseWriter errorResponseWriter;

    @Override
    @NonNull
    public Mono<Void> handle(@NonNull ServerWebExchange exchange, @NonNull Throwable ex) {

        ServerHttpResponse response = exchange.getResponse();
        String path = exchange.getRequest().getURI().getPath();

        if (response.isCommitted()) {
            log.warn("Response already committed, cannot write error for path={} error={}", path, ex.getMessage());
            return Mono.error(ex);
        }

        HttpStatus status;
        String message;

        if (ex instanceof ResponseStatusException rse) {
            status = HttpStatus.resolve(rse.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }
            String reason = rse.getReason();
            message = (reason != null && !reason.isBlank()) ? reason : status.getReasonPhrase();
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            message = "An unexpected error occurred.";
        }

        if (status.is5xxServerError()) {
            log.error("Gateway error: status={} path={} error={}", status.value(), path, ex.getMessage(), ex);
        } else {
            log.warn("Gateway error: status={} path={} error={}", status.value(), path, ex.getMessage());
        }

        return errorResponseWriter.write(response, status, message);
    }
}

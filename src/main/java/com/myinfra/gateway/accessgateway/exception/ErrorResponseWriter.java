package com.myinfra.gateway.accessgateway.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Serializes an {@link ErrorResponse} into a reactive response.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;

    /**
     * Writes the envelope as JSON with the matching status code.
     *
     * @param response      The server HTTP response
     * @param status        HTTP status to set on the response
     * @param errorResponse The payload to serialize
     * @return {@code Mono<Void>} completing when the write is done
     */
    public Mono<Void> write(ServerHttpResponse response, HttpStatus status, ErrorResponse errorResponse) {
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(errorResponse);
        } catch (JsonProcessingException jsonEx) {
            log.error("Failed to serialize ErrorResponse to JSON", jsonEx);
            String fallbackJson = String.format(
                    "{\"statusCode\":%d,\"message\":\"%s\",\"error\":\"%s\"}",
                    status.value(), status.getReasonPhrase(), status.getReasonPhrase());
            bytes = fallbackJson.getBytes(StandardCharsets.UTF_8);
        }

        DataBuffer buffer = response.bufferFactory().wrap(Objects.requireNonNull(bytes));
        return response.writeWith(Mono.just(buffer));
    }

    public Mono<Void> write(ServerHttpResponse response, HttpStatus status, String message) {
        return write(response, status, ErrorResponse.of(status, message));
    }
}

package com.myinfra.gateway.accessgateway.exception;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error envelope written by the gateway whenever it answers instead of a backend.
 */
@Getter
@Builder
@JsonPropertyOrder({"statusCode", "message", "error"})
public class ErrorResponse {

    private final int statusCode;

    private final String message;

    private final String error;

    /**
     * Static factory method for convenient instantiation.
     *
     * @param status  HTTP status; its reason phrase becomes the error field
     * @param message Human readable message
     * @return A fully constructed ErrorResponse instance
     */
    public static ErrorResponse of(HttpStatus status, String message) {
        return ErrorResponse.builder()
                .statusCode(status.value())
                .message(message)
                .error(status.getReasonPhrase())
                .build();
    }
}

package com.myinfra.gateway.accessgateway.service;

import io.netty.channel.ConnectTimeoutException;
import org.springframework.http.HttpStatus;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Ways a forwarded request can fail before any backend response arrives, with the status
 * reported to the client for each.
 */
public enum TransportFailure {

    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service unavailable"),
    TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Gateway timeout"),
    BAD_GATEWAY(HttpStatus.BAD_GATEWAY, "Bad gateway");

    private static final int MAX_CAUSE_DEPTH = 10;

    private final HttpStatus status;
    private final String message;

    TransportFailure(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus status() {
        return status;
    }

    public String message() {
        return message;
    }

    /**
     * Walks the cause chain: a timeout anywhere means {@link #TIMEOUT}, a refused connection or an
     * unresolvable host means {@link #UNAVAILABLE}, anything else is {@link #BAD_GATEWAY}.
     */
    public static TransportFailure classify(Throwable t) {
        Throwable curr = t;
        int depth = 0;
        while (curr != null && depth++ < MAX_CAUSE_DEPTH) {
            if (isTimeout(curr)) {
                return TIMEOUT;
            }
            if (curr instanceof ConnectException || curr instanceof UnknownHostException) {
                return UNAVAILABLE;
            }
            curr = curr.getCause() == curr ? null : curr.getCause();
        }
        return BAD_GATEWAY;
    }

    private static boolean isTimeout(Throwable t) {
        // ReadTimeoutException from Reactor Netty's responseTimeout extends Netty's TimeoutException
        return t instanceof TimeoutException
                || t instanceof io.netty.handler.timeout.TimeoutException
                || t instanceof ConnectTimeoutException
                || t instanceof SocketTimeoutException;
    }
}

package com.myinfra.gateway.accessgateway.exception;

/**
 * Raised while loading routing or service configuration. Only thrown during startup,
 * where it aborts the application context.
 */
public class GatewayConfigurationException extends RuntimeException {

    public GatewayConfigurationException(String message) {
        super(message);
    }

    public GatewayConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

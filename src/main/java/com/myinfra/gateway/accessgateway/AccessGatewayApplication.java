package com.myinfra.gateway.accessgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Access Gateway Application
 *
 * Single entry point in front of the access platform's backends (auth, RBAC core, audit log).
 * Handles:
 * - Service registry with periodic health checks
 * - Route mapping and path rewriting driven by JSON configuration
 * - Reverse proxying with normalized error responses
 */
@SpringBootApplication
public class AccessGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessGatewayApplication.class, args);
    }
}

package com.myinfra.gateway.accessgateway.config;

import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Declares the catch-all gateway route. Requests on it never reach the route URI:
 * {@link com.myinfra.gateway.accessgateway.filter.GatewayProxyFilter} answers them itself.
 */
@Configuration
public class GatewayRouteConfig {

    public static final String CATCH_ALL_ROUTE_ID = "backend-catch-all";

    @Bean
    public RouteLocator gatewayRouteLocator(RouteLocatorBuilder builder, AppConfig appConfig) {
        return builder.routes()
                .route(CATCH_ALL_ROUTE_ID, r -> r
                        .path(appConfig.getGatewayConfig().getRoutePrefix())
                        .uri("no://op"))
                .build();
    }
}

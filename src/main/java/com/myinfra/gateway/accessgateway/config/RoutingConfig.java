package com.myinfra.gateway.accessgateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.accessgateway.config.route.EnvironmentInterpolator;
import com.myinfra.gateway.accessgateway.config.route.RouteMappingConfigLoader;
import com.myinfra.gateway.accessgateway.config.route.RouteMappingConfiguration;
import com.myinfra.gateway.accessgateway.registry.LegacyServiceCatalog;
import com.myinfra.gateway.accessgateway.routing.RouteResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Wires the route mapping configuration and the compiled resolver. Any
 * {@link com.myinfra.gateway.accessgateway.exception.GatewayConfigurationException} thrown here
 * stops the application from starting.
 */
@Configuration
public class RoutingConfig {

    @Bean
    public EnvironmentInterpolator environmentInterpolator(Environment environment) {
        return new EnvironmentInterpolator(environment);
    }

    @Bean
    public RouteMappingConfigLoader routeMappingConfigLoader(ObjectMapper objectMapper,
                                                             EnvironmentInterpolator environmentInterpolator,
                                                             AppConfig appConfig) {
        return new RouteMappingConfigLoader(objectMapper, environmentInterpolator, appConfig.getRouting());
    }

    @Bean
    public RouteMappingConfiguration routeMappingConfiguration(RouteMappingConfigLoader loader) {
        return loader.load();
    }

    @Bean
    public RouteResolver routeResolver(RouteMappingConfigLoader loader, RouteMappingConfiguration configuration) {
        return new RouteResolver(loader.compile(configuration));
    }

    @Bean
    public LegacyServiceCatalog legacyServiceCatalog(ObjectMapper objectMapper,
                                                     EnvironmentInterpolator environmentInterpolator) {
        return new LegacyServiceCatalog(objectMapper, environmentInterpolator);
    }
}

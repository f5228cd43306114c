package com.myinfra.gateway.accessgateway.config.route;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.myinfra.gateway.accessgateway.exception.GatewayConfigurationException;
import com.myinfra.gateway.accessgateway.routing.PatternCompiler;
import com.myinfra.gateway.accessgateway.routing.PatternKind;
import com.myinfra.gateway.accessgateway.routing.RouteMapping;
import com.myinfra.gateway.accessgateway.routing.RouteTransformation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Uncompiled route mapping entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteMappingDefinition {

    private String id;
    private String pattern;
    private PatternKind patternType;
    private String service;
    private Integer priority;
    private List<String> methods;
    private String description;
    private Transformations transformations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Transformations {
        private Boolean stripPrefix;
        private String rewrite;
    }

    public RouteMapping compile() {
        if (service == null || service.isBlank()) {
            throw new GatewayConfigurationException("Route mapping '" + pattern + "' does not name a service");
        }

        RouteTransformation transformation = transformations == null
                ? null
                : new RouteTransformation(Boolean.TRUE.equals(transformations.getStripPrefix()),
                        transformations.getRewrite());

        return new RouteMapping(
                id,
                PatternCompiler.compile(pattern, patternType),
                service,
                transformation,
                priority,
                methods,
                description);
    }
}

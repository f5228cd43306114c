package com.myinfra.gateway.accessgateway.config.route;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Route mapping document as loaded from a file, the environment or the built-in defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteMappingConfiguration {

    private String version;

    @Builder.Default
    private List<ServiceDefinition> services = new ArrayList<>();

    @Builder.Default
    private List<RouteMappingDefinition> routeMappings = new ArrayList<>();

    private GlobalSettings globalSettings;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GlobalSettings {
        private Long defaultTimeout;
        private Integer defaultRetries;
        private Boolean enableHealthChecks;
    }

    public boolean healthChecksEnabled() {
        return globalSettings == null
                || globalSettings.getEnableHealthChecks() == null
                || globalSettings.getEnableHealthChecks();
    }
}

package com.myinfra.gateway.accessgateway.config.route;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.accessgateway.config.AppConfig.RouteSourceConfig;
import com.myinfra.gateway.accessgateway.exception.GatewayConfigurationException;
import com.myinfra.gateway.accessgateway.routing.RouteMapping;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads the route mapping document. Sources are tried in order and the first one that parses wins:
 * <ol>
 *     <li>the explicitly configured file (failure is fatal)</li>
 *     <li>the default file locations (failures are skipped)</li>
 *     <li>a JSON document held in an environment variable (failure is fatal)</li>
 *     <li>the built-in defaults</li>
 * </ol>
 * String values are interpolated against the environment before binding.
 */
@Slf4j
public class RouteMappingConfigLoader {

    private final ObjectMapper objectMapper;
    private final EnvironmentInterpolator interpolator;
    private final RouteSourceConfig sourceConfig;

    public RouteMappingConfigLoader(ObjectMapper objectMapper,
                                    EnvironmentInterpolator interpolator,
                                    RouteSourceConfig sourceConfig) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        this.interpolator = Objects.requireNonNull(interpolator, "EnvironmentInterpolator must not be null");
        this.sourceConfig = Objects.requireNonNull(sourceConfig, "RouteSourceConfig must not be null");
    }

    public RouteMappingConfiguration load() {
        String explicitPath = sourceConfig.getConfigPath();
        if (explicitPath != null && !explicitPath.isBlank()) {
            RouteMappingConfiguration config = loadFromFile(Path.of(explicitPath));
            log.info("Loaded route mapping configuration v{} from {}", config.getVersion(), explicitPath);
            return config;
        }

        for (String candidate : sourceConfig.getDefaultPaths()) {
            Path path = Path.of(candidate);
            if (!Files.isReadable(path)) {
                continue;
            }
            try {
                RouteMappingConfiguration config = loadFromFile(path);
                log.info("Loaded route mapping configuration v{} from {}", config.getVersion(), path);
                return config;
            } catch (GatewayConfigurationException e) {
                log.debug("Skipping route mapping file {}: {}", path, e.getMessage());
            }
        }

        String variable = sourceConfig.getEnvironmentVariable();
        String inline = interpolator.lookup(variable, null);
        if (inline != null && !inline.isBlank()) {
            try {
                RouteMappingConfiguration config = parse(inline);
                log.info("Loaded route mapping configuration v{} from environment variable {}",
                        config.getVersion(), variable);
                return config;
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new GatewayConfigurationException(
                        "Failed to parse " + variable + " from environment: " + e.getMessage(), e);
            }
        }

        log.info("No route mapping configuration found, using built-in defaults");
        return DefaultRouteMappings.create(interpolator);
    }

    /**
     * Compiles every route mapping entry, keeping configuration order.
     *
     * @throws GatewayConfigurationException if any pattern is invalid
     */
    public List<RouteMapping> compile(RouteMappingConfiguration config) {
        List<RouteMapping> mappings = new ArrayList<>();
        for (RouteMappingDefinition definition : config.getRouteMappings()) {
            RouteMapping mapping = definition.compile();
            mappings.add(mapping);
            log.info("Registered route mapping: {} -> {} ({})", definition.getPattern(), definition.getService(),
                    definition.getPatternType() == null ? "regex" : definition.getPatternType().value());
        }
        log.info("Loaded {} route mappings from configuration v{}", mappings.size(), config.getVersion());
        return mappings;
    }

    private RouteMappingConfiguration loadFromFile(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException | IllegalArgumentException e) {
            throw new GatewayConfigurationException(
                    "Failed to load route mapping config from " + path + ": " + e.getMessage(), e);
        }
    }

    private RouteMappingConfiguration parse(String json) throws JsonProcessingException {
        JsonNode tree = objectMapper.readTree(json);
        if (tree == null || !tree.isObject()) {
            throw new IllegalArgumentException("route mapping configuration must be a JSON object");
        }
        RouteMappingConfiguration config = objectMapper.treeToValue(interpolator.interpolate(tree),
                RouteMappingConfiguration.class);
        if (config.getServices() == null) {
            config.setServices(new ArrayList<>());
        }
        if (config.getRouteMappings() == null) {
            config.setRouteMappings(new ArrayList<>());
        }
        return config;
    }
}

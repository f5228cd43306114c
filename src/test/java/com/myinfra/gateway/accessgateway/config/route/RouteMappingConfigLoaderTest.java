package com.myinfra.gateway.accessgateway.config.route;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.accessgateway.config.AppConfig.RouteSourceConfig;
import com.myinfra.gateway.accessgateway.exception.GatewayConfigurationException;
import com.myinfra.gateway.accessgateway.routing.PatternKind;
import com.myinfra.gateway.accessgateway.routing.RouteMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouteMappingConfigLoaderTest {

    private static final String FILE_CONFIG = """
            {
              "version": "2.0.0",
              "services": [
                {"id": "auth-service", "name": "Auth", "baseUrl": "${AUTH_URL:http://localhost:3001}"},
                {"id": "rbac-core", "host": "${RBAC_HOST:localhost}", "port": "${RBAC_PORT:3100}"}
              ],
              "routeMappings": [
                {"id": "login", "pattern": "^/api/auth/(login|logout)", "service": "auth-service",
                 "priority": 5, "transformations": {"rewrite": "/auth"}},
                {"pattern": "/api/tenants*", "patternType": "glob", "service": "rbac-core"},
                {"pattern": "/api/users", "patternType": "exact", "service": "rbac-core",
                 "transformations": {"stripPrefix": true}}
              ],
              "globalSettings": {"defaultTimeout": 1000, "defaultRetries": 1, "enableHealthChecks": false}
            }
            """;

    @TempDir
    Path tempDir;

    private MockEnvironment environment;
    private RouteSourceConfig sourceConfig;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        sourceConfig = new RouteSourceConfig();
        sourceConfig.setDefaultPaths(List.of(tempDir.resolve("missing.json").toString()));
        objectMapper = new ObjectMapper();
    }

    private RouteMappingConfigLoader loader() {
        return new RouteMappingConfigLoader(objectMapper, new EnvironmentInterpolator(environment), sourceConfig);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("explicit file is loaded with environment interpolation")
    void loadsExplicitFile() throws IOException {
        environment.setProperty("RBAC_HOST", "rbac.internal");
        sourceConfig.setConfigPath(write("routes.json", FILE_CONFIG).toString());

        RouteMappingConfiguration config = loader().load();

        assertThat(config.getVersion()).isEqualTo("2.0.0");
        assertThat(config.getServices()).hasSize(2);
        assertThat(config.getServices().get(0).getBaseUrl()).isEqualTo("http://localhost:3001");
        assertThat(config.getServices().get(1).getHost()).isEqualTo("rbac.internal");
        assertThat(config.getServices().get(1).getPort()).isEqualTo(3100);
        assertThat(config.getRouteMappings()).extracting(RouteMappingDefinition::getPatternType)
                .containsExactly(null, PatternKind.GLOB, PatternKind.EXACT);
        assertThat(config.healthChecksEnabled()).isFalse();
    }

    @Test
    @DisplayName("malformed explicit file is fatal")
    void malformedExplicitFileFails() throws IOException {
        sourceConfig.setConfigPath(write("broken.json", "{ \"version\": ").toString());

        assertThatThrownBy(() -> loader().load())
                .isInstanceOf(GatewayConfigurationException.class)
                .hasMessageContaining("broken.json");
    }

    @Test
    @DisplayName("missing explicit file is fatal")
    void missingExplicitFileFails() {
        sourceConfig.setConfigPath(tempDir.resolve("nowhere.json").toString());

        assertThatThrownBy(() -> loader().load()).isInstanceOf(GatewayConfigurationException.class);
    }

    @Test
    @DisplayName("default paths are tried in order, skipping unreadable or broken files")
    void defaultPathsFallThrough() throws IOException {
        Path broken = write("broken.json", "not json");
        Path good = write("good.json", FILE_CONFIG);
        sourceConfig.setDefaultPaths(List.of(
                tempDir.resolve("absent.json").toString(), broken.toString(), good.toString()));

        assertThat(loader().load().getVersion()).isEqualTo("2.0.0");
    }

    @Test
    @DisplayName("environment variable document is used when no file is found")
    void loadsFromEnvironmentVariable() {
        environment.setProperty("ROUTE_MAPPING_CONFIG", """
                {"version": "env", "services": [],
                 "routeMappings": [{"pattern": "^/api/x", "service": "x"}]}
                """);

        RouteMappingConfiguration config = loader().load();

        assertThat(config.getVersion()).isEqualTo("env");
        assertThat(config.getRouteMappings()).hasSize(1);
        assertThat(config.healthChecksEnabled()).isTrue();
    }

    @Test
    @DisplayName("a file found on a default path wins over the environment variable")
    void fileWinsOverEnvironment() throws IOException {
        sourceConfig.setDefaultPaths(List.of(write("routes.json", FILE_CONFIG).toString()));
        environment.setProperty("ROUTE_MAPPING_CONFIG", "{\"version\": \"env\"}");

        assertThat(loader().load().getVersion()).isEqualTo("2.0.0");
    }

    @Test
    void malformedEnvironmentDocumentFails() {
        environment.setProperty("ROUTE_MAPPING_CONFIG", "[1, 2");

        assertThatThrownBy(() -> loader().load())
                .isInstanceOf(GatewayConfigurationException.class)
                .hasMessageContaining("ROUTE_MAPPING_CONFIG");
    }

    @Test
    @DisplayName("built-in defaults describe auth, rbac and audit backends")
    void builtInDefaults() {
        environment.setProperty("AUTH_SERVICE_URL", "http://auth.internal:9000");
        environment.setProperty("RBAC_SERVICE_HOST", "rbac.internal");

        RouteMappingConfiguration config = loader().load();

        assertThat(config.getServices()).extracting(ServiceDefinition::registryName)
                .containsExactly("auth-service", "rbac-core", "audit-log-service");
        assertThat(config.getServices()).extracting(ServiceDefinition::getBaseUrl)
                .containsExactly("http://auth.internal:9000", "http://rbac.internal:3100",
                        "http://localhost:3300");
        assertThat(config.getRouteMappings()).extracting(RouteMappingDefinition::getPattern)
                .containsExactly("/api/auth/.*", "/api/rbac/.*", "/api/audit/.*");
        assertThat(config.getGlobalSettings().getDefaultTimeout()).isEqualTo(5000L);
    }

    @Test
    @DisplayName("compiled mappings keep configuration order and transformations")
    void compileKeepsOrder() throws IOException {
        sourceConfig.setConfigPath(write("routes.json", FILE_CONFIG).toString());
        RouteMappingConfigLoader loader = loader();

        List<RouteMapping> mappings = loader.compile(loader.load());

        assertThat(mappings).extracting(RouteMapping::serviceName)
                .containsExactly("auth-service", "rbac-core", "rbac-core");
        assertThat(mappings.get(0).id()).isEqualTo("login");
        assertThat(mappings.get(0).priority()).isEqualTo(5);
        assertThat(mappings.get(0).transformation().rewrite()).isEqualTo("/auth");
        assertThat(mappings.get(0).transformation().stripPrefix()).isFalse();
        assertThat(mappings.get(1).pattern().pattern()).isEqualTo("^/api/tenants.*$");
        assertThat(mappings.get(1).transformation()).isNull();
        assertThat(mappings.get(2).transformation().stripPrefix()).isTrue();
        assertThat(mappings.get(2).matches("/api/users/1")).isFalse();
    }

    @Test
    @DisplayName("an invalid pattern fails at load time")
    void invalidPatternFailsCompile() {
        environment.setProperty("ROUTE_MAPPING_CONFIG",
                "{\"routeMappings\": [{\"pattern\": \"^/api/(x\", \"service\": \"x\"}]}");
        RouteMappingConfigLoader loader = loader();
        RouteMappingConfiguration config = loader.load();

        assertThatThrownBy(() -> loader.compile(config)).isInstanceOf(GatewayConfigurationException.class);
    }

    @Test
    void mappingWithoutServiceFailsCompile() {
        environment.setProperty("ROUTE_MAPPING_CONFIG", "{\"routeMappings\": [{\"pattern\": \"^/api/x\"}]}");
        RouteMappingConfigLoader loader = loader();
        RouteMappingConfiguration config = loader.load();

        assertThatThrownBy(() -> loader.compile(config)).isInstanceOf(GatewayConfigurationException.class);
    }
}

package com.myinfra.gateway.accessgateway.controller;

import com.myinfra.gateway.accessgateway.config.AppConfig;
import com.myinfra.gateway.accessgateway.model.ServiceDescriptor;
import com.myinfra.gateway.accessgateway.registry.ServiceRegistry;
import com.myinfra.gateway.accessgateway.routing.RouteMapping;
import com.myinfra.gateway.accessgateway.routing.RouteResolver;
import com.myinfra.gateway.accessgateway.routing.RouteTransformation;
import com.myinfra.gateway.accessgateway.service.ServiceDocsAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class GatewayControllerTest {

    @Mock
    private ServiceRegistry serviceRegistry;

    @Mock
    private ServiceDocsAggregator docsAggregator;

    private WebTestClient client;

    private final ServiceDescriptor rbac = new ServiceDescriptor("rbac-core", "rbac.internal", 3100, "/health",
            "2.1.0", Set.of("rbac"), List.of("/api/tenants", "/api/users"));

    @BeforeEach
    void setUp() {
        RouteResolver resolver = new RouteResolver(List.of(
                new RouteMapping("rbac-routes", Pattern.compile("^/api/rbac/"), "rbac-core",
                        new RouteTransformation(true, null), 90, List.of("GET"), "RBAC")));
        AppConfig appConfig = new AppConfig();
        appConfig.getGatewayConfig().setServiceName("access-gateway");
        appConfig.getGatewayConfig().setVersion("1.4.0");

        client = WebTestClient.bindToController(new GatewayController(serviceRegistry, resolver, docsAggregator, appConfig)).build();
    }

    @Test
    void healthReportsGatewayName() {
        client.get().uri("/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.service").isEqualTo("access-gateway")
                .jsonPath("$.timestamp").isNotEmpty();
    }

    @Test
    void servicesListsRegistryContents() {
        given(serviceRegistry.getAllServices()).willReturn(List.of(rbac));

        client.get().uri("/services").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(1)
                .jsonPath("$.services[0].name").isEqualTo("rbac-core")
                .jsonPath("$.services[0].port").isEqualTo(3100)
                .jsonPath("$.services[0].version").isEqualTo("2.1.0");
    }

    @Test
    void serviceHealthReportsCheckResult() {
        given(serviceRegistry.healthCheck("rbac-core")).willReturn(Mono.just(false));
        given(serviceRegistry.discover("rbac-core")).willReturn(Optional.of(rbac));

        client.get().uri("/services/rbac-core/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("rbac-core")
                .jsonPath("$.healthy").isEqualTo(false)
                .jsonPath("$.info.host").isEqualTo("rbac.internal");
    }

    @Test
    void unknownServiceHealthIsFalseWithoutInfo() {
        given(serviceRegistry.healthCheck("ghost")).willReturn(Mono.just(false));
        given(serviceRegistry.discover("ghost")).willReturn(Optional.empty());

        client.get().uri("/services/ghost/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.healthy").isEqualTo(false)
                .jsonPath("$.info").doesNotExist();
    }

    @Test
    void docsWrapCollectedDocuments() {
        given(docsAggregator.collect()).willReturn(Mono.just(List.of(
                Map.<String, Object>of("service", "rbac-core", "version", "2.1.0"))));

        client.get().uri("/docs").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.gateway.name").isEqualTo("access-gateway")
                .jsonPath("$.gateway.version").isEqualTo("1.4.0")
                .jsonPath("$.services[0].service").isEqualTo("rbac-core");
    }

    @Test
    void routesAreBuiltFromAdvertisedPrefixes() {
        given(serviceRegistry.getAllServices()).willReturn(List.of(rbac));

        client.get().uri("/routes").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalRoutes").isEqualTo(2)
                .jsonPath("$.routes['/api/tenants'].service").isEqualTo("rbac-core")
                .jsonPath("$.routes['/api/users'].target").isEqualTo("rbac.internal:3100");
    }

    @Test
    void routeMappingsDescribeCompiledTable() {
        client.get().uri("/route-mappings").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("rbac-routes")
                .jsonPath("$[0].pattern").isEqualTo("^/api/rbac/")
                .jsonPath("$[0].service").isEqualTo("rbac-core")
                .jsonPath("$[0].transformations.stripPrefix").isEqualTo(true)
                .jsonPath("$[0].priority").isEqualTo(90);
    }
}

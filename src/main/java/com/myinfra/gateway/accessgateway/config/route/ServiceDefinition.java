package com.myinfra.gateway.accessgateway.config.route;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.myinfra.gateway.accessgateway.model.AddressSpec;
import com.myinfra.gateway.accessgateway.model.ServiceDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * A backend service as written in configuration. Accepts both the {@code baseUrl} form and
 * the {@code host}/{@code port} form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceDefinition {

    private String id;
    private String name;
    private String version;
    private String baseUrl;
    private String host;
    private Integer port;
    private String healthCheck;
    private String health;
    private Long timeout;
    private Integer retries;
    private List<String> tags;
    private List<String> routes;
    private String environment;
    private String description;

    /**
     * Registry key: the id when present, otherwise the name.
     */
    public String registryName() {
        return id != null && !id.isBlank() ? id : name;
    }

    /**
     * Resolves the address form and builds the canonical descriptor.
     *
     * @throws com.myinfra.gateway.accessgateway.exception.GatewayConfigurationException when no address is usable
     */
    public ServiceDescriptor toDescriptor() {
        String serviceName = registryName();
        AddressSpec address = AddressSpec.of(serviceName, baseUrl, host, port);
        String healthPath = healthCheck != null ? healthCheck : health;
        return ServiceDescriptor.of(
                serviceName,
                address,
                healthPath,
                version,
                tags == null ? null : new LinkedHashSet<>(tags),
                routes);
    }
}

package com.myinfra.gateway.accessgateway.model;

import com.myinfra.gateway.accessgateway.exception.GatewayConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Where a backend lives, as written in configuration: either a base URL or an explicit host and port.
 */
public sealed interface AddressSpec permits AddressSpec.Url, AddressSpec.HostPort {

    String host();

    int port();

    /**
     * Picks the address form declared by a service definition. A base URL wins over host and port.
     *
     * @param serviceName name used in error messages
     * @param baseUrl     configured base URL, may be null
     * @param host        configured host, may be null
     * @param port        configured port, may be null
     * @return the resolved address
     * @throws GatewayConfigurationException when neither form is usable
     */
    static AddressSpec of(String serviceName, String baseUrl, String host, Integer port) {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return new Url(serviceName, baseUrl);
        }
        if (host != null && !host.isBlank() && port != null && port > 0) {
            return new HostPort(host, port);
        }
        throw new GatewayConfigurationException(
                "Service " + serviceName + " must have either 'baseUrl' or both 'host' and 'port' configured");
    }

    record Url(String host, int port, String value) implements AddressSpec {

        Url(String serviceName, String value) {
            this(parse(serviceName, value), value);
        }

        private Url(URI uri, String value) {
            this(uri.getHost(), portOf(uri), value);
        }

        private static URI parse(String serviceName, String value) {
            try {
                URI uri = new URI(value.trim());
                if (uri.getHost() == null) {
                    throw new URISyntaxException(value, "missing host");
                }
                return uri;
            } catch (URISyntaxException e) {
                throw new GatewayConfigurationException(
                        "Invalid baseUrl '" + value + "' for service " + serviceName + ": " + e.getMessage(), e);
            }
        }

        private static int portOf(URI uri) {
            if (uri.getPort() > 0) {
                return uri.getPort();
            }
            String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
            return "https".equals(scheme) ? 443 : 80;
        }
    }

    record HostPort(String host, int port) implements AddressSpec {
    }
}

package com.myinfra.gateway.accessgateway.registry;

import com.myinfra.gateway.accessgateway.model.ServiceDescriptor;
import com.myinfra.gateway.accessgateway.routing.RouteMapping;

/**
 * A request path resolved to its backend.
 *
 * @param service Registered backend that serves the path
 * @param mapping Mapping that selected the backend
 */
public record RouteTarget(ServiceDescriptor service, RouteMapping mapping) {
}

package com.myinfra.gateway.accessgateway.routing;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A compiled routing rule binding a path pattern to a target service.
 *
 * @param id             Identifier from configuration, may be null
 * @param pattern        Compiled matcher applied to the full path including the query string
 * @param serviceName    Name of the target service; resolved against the registry at request time
 * @param transformation Optional path transformation, null when the path is forwarded as is
 * @param priority       Declared priority. Informational only: mappings are tried in configuration order
 * @param methods        Declared HTTP methods. Informational only
 * @param description    Free text
 */
public record RouteMapping(
        String id,
        Pattern pattern,
        String serviceName,
        RouteTransformation transformation,
        Integer priority,
        List<String> methods,
        String description) {

    public RouteMapping {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public static RouteMapping of(Pattern pattern, String serviceName, RouteTransformation transformation) {
        return new RouteMapping(null, pattern, serviceName, transformation, null, null, null);
    }

    public boolean matches(String path) {
        return path != null && pattern.matcher(path).find();
    }
}

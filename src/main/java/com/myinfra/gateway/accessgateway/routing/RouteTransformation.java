package com.myinfra.gateway.accessgateway.routing;

/**
 * Path transformation attached to a route mapping. Kept exactly as configured;
 * {@link RouteResolver#transform(String, RouteMapping)} decides how it applies.
 *
 * @param stripPrefix Remove the matched segment before forwarding
 * @param rewrite     Replacement path, possibly with {@code $n} group references
 */
public record RouteTransformation(boolean stripPrefix, String rewrite) {

    public boolean hasRewrite() {
        return rewrite != null && !rewrite.isEmpty();
    }
}

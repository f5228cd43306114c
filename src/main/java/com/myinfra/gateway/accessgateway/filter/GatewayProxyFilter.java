package com.myinfra.gateway.accessgateway.filter;

import com.myinfra.gateway.accessgateway.config.GatewayRouteConfig;
import com.myinfra.gateway.accessgateway.service.ProxyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.cloud.gateway.route.Route;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Hands every request on the catch-all route to {@link ProxyService}. The chain is not
 * continued for those requests: the proxy writes the response itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayProxyFilter implements GlobalFilter, Ordered {

    private final ProxyService proxyService;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        Route route = exchange.getAttribute(ServerWebExchangeUtils.GATEWAY_ROUTE_ATTR);
        if (route != null && !GatewayRouteConfig.CATCH_ALL_ROUTE_ID.equals(route.getId())) {
            return chain.filter(exchange);
        }

        ServerWebExchangeUtils.setAlreadyRouted(exchange);
        return proxyService.forward(exchange);
    }

    /**
     * Runs after request logging and before Spring Cloud Gateway's own routing filters.
     *
     * @return filter order priority
     */
    @Override
    public int getOrder() {
        return -1;
    }
}

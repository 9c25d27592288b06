package com.watchflixx.gateway.web;

import com.watchflixx.gateway.service.ProxyHeaders;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * 为每个请求确定请求 ID：沿用调用方的 X-Request-ID，缺失或过长时生成新的
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdWebFilter implements WebFilter {

    static final int MAX_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String incoming = exchange.getRequest().getHeaders().getFirst(ProxyHeaders.REQUEST_ID);
        String requestId = incoming == null || incoming.isBlank() || incoming.length() > MAX_LENGTH
                ? UUID.randomUUID().toString()
                : incoming.trim();
        exchange.getAttributes().put(RequestContext.REQUEST_ID_ATTRIBUTE, requestId);
        exchange.getResponse().getHeaders().set(ProxyHeaders.REQUEST_ID, requestId);
        return chain.filter(exchange);
    }
}

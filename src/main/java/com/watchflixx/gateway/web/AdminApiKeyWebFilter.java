package com.watchflixx.gateway.web;

import com.watchflixx.gateway.config.GatewayProperties;
import com.watchflixx.gateway.error.AuthenticationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * /admin/** 需要 X-API-Key，未配置任何密钥时管理接口全部拒绝
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class AdminApiKeyWebFilter implements WebFilter {

    public static final String API_KEY_HEADER = "X-API-Key";
    static final String ADMIN_PREFIX = "/admin";

    private final GatewayProperties properties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!path.equals(ADMIN_PREFIX) && !path.startsWith(ADMIN_PREFIX + "/")) {
            return chain.filter(exchange);
        }
        String presented = exchange.getRequest().getHeaders().getFirst(API_KEY_HEADER);
        if (!isValid(presented)) {
            log.warn("Rejected admin request {} from {}: invalid API key",
                    path, RequestContext.clientAddress(exchange, properties.getTrustedProxies()));
            return Mono.error(new AuthenticationException("Valid X-API-Key header required"));
        }
        return chain.filter(exchange);
    }

    boolean isValid(String presented) {
        if (presented == null || presented.isEmpty()) {
            return false;
        }
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        for (String key : properties.getAdminApiKeys()) {
            if (key != null && !key.isEmpty()
                    && MessageDigest.isEqual(candidate, key.getBytes(StandardCharsets.UTF_8))) {
                return true;
            }
        }
        return false;
    }
}

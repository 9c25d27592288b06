package com.watchflixx.gateway.web;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetSocketAddress;
import java.util.Collection;

/**
 * 请求级上下文读取工具
 */
public final class RequestContext {

    public static final String REQUEST_ID_ATTRIBUTE = RequestContext.class.getName() + ".requestId";
    static final String FORWARDED_FOR = "X-Forwarded-For";

    private RequestContext() {
    }

    public static String requestId(ServerWebExchange exchange) {
        return exchange.getAttribute(REQUEST_ID_ATTRIBUTE);
    }

    /**
     * 客户端地址
     *
     * <p>默认取连接的远端地址。只有远端是可信代理时才读取 X-Forwarded-For，
     * 从右向左跳过可信代理，返回第一个不可信的地址；全部可信时返回最左侧一段。
     *
     * @param trustedProxies 可信反向代理的 IP
     */
    public static String clientAddress(ServerWebExchange exchange, Collection<String> trustedProxies) {
        ServerHttpRequest request = exchange.getRequest();
        String peer = remoteAddress(request);
        if (peer == null || trustedProxies == null || !trustedProxies.contains(peer)) {
            return peer;
        }
        String forwarded = request.getHeaders().getFirst(FORWARDED_FOR);
        if (forwarded == null || forwarded.isBlank()) {
            return peer;
        }
        String[] hops = forwarded.split(",");
        String leftmost = peer;
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (hop.isEmpty()) {
                continue;
            }
            if (!trustedProxies.contains(hop)) {
                return hop;
            }
            leftmost = hop;
        }
        return leftmost;
    }

    private static String remoteAddress(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null) {
            return null;
        }
        return remote.getAddress() == null ? remote.getHostString() : remote.getAddress().getHostAddress();
    }
}

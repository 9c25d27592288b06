package com.watchflixx.gateway.web;

import com.watchflixx.gateway.config.GatewayProperties;
import com.watchflixx.gateway.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;

import java.time.Clock;
import java.time.Instant;

/**
 * 为网关自身的响应补齐时间戳、请求 ID 和 API 版本
 */
@Component
@RequiredArgsConstructor
public class ResponseEnvelope {

    private final GatewayProperties properties;
    private final Clock clock;

    public <T> ApiResponse<T> ok(T data, ServerWebExchange exchange) {
        return stamp(ApiResponse.ok(data), exchange);
    }

    public <T> ApiResponse<T> ok(T data, String message, ServerWebExchange exchange) {
        return stamp(ApiResponse.ok(data, message), exchange);
    }

    public <T> ApiResponse<T> stamp(ApiResponse<T> response, ServerWebExchange exchange) {
        response.setTimestamp(Instant.now(clock).toString());
        response.setRequestId(exchange == null ? null : RequestContext.requestId(exchange));
        response.setVersion(properties.getApiVersion());
        return response;
    }
}

package com.watchflixx.gateway.web;

import com.watchflixx.gateway.config.GatewayProperties;
import com.watchflixx.gateway.service.CallerIdentityResolver;
import com.watchflixx.gateway.service.InboundRequest;
import com.watchflixx.gateway.service.ProxyHeaders;
import com.watchflixx.gateway.service.ProxyService;
import io.swagger.v3.oas.annotations.Hidden;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * 统一代理入口：/api/** 下的所有方法都交给 {@link ProxyService}
 *
 * <p>请求体整体读入后转发，响应状态码、响应头和响应体原样返回给调用方。
 */
@Hidden
@RestController
@RequiredArgsConstructor
public class GatewayController {

    private static final byte[] EMPTY = new byte[0];

    private final ProxyService proxyService;
    private final CallerIdentityResolver identityResolver;
    private final GatewayProperties properties;

    @RequestMapping("/api/**")
    public Mono<ResponseEntity<byte[]>> proxy(ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        String requestId = RequestContext.requestId(exchange);
        return readBody(request)
                .map(body -> InboundRequest.builder()
                        .method(request.getMethod())
                        .path(request.getURI().getRawPath())
                        .query(request.getURI().getRawQuery())
                        .headers(request.getHeaders())
                        .body(body.length == 0 ? null : body)
                        .clientAddress(RequestContext.clientAddress(exchange, properties.getTrustedProxies()))
                        .requestId(requestId)
                        .identity(identityResolver.resolve(request.getHeaders()))
                        .build())
                .flatMap(proxyService::handle)
                .map(result -> ResponseEntity.status(result.getResponse().getStatusCode())
                        .headers(ProxyHeaders.response(result, requestId))
                        .body(result.getResponse().getBody()));
    }

    private static Mono<byte[]> readBody(ServerHttpRequest request) {
        return DataBufferUtils.join(request.getBody())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(EMPTY);
    }
}

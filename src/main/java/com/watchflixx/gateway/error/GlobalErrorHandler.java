package com.watchflixx.gateway.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchflixx.gateway.config.GatewayProperties;
import com.watchflixx.gateway.dto.ApiResponse;
import com.watchflixx.gateway.service.ProxyHeaders;
import com.watchflixx.gateway.web.RequestContext;
import com.watchflixx.gateway.web.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 网关所有错误的最终出口，统一写成 {@link ApiResponse} 信封
 *
 * <p>5xx 的内部细节不会返回给调用方；结构化 details 只在诊断模式下输出。
 * 限流错误额外写入 X-RateLimit-* 和 Retry-After 响应头。
 */
@Component
@Order(-2)
@Slf4j
@RequiredArgsConstructor
public class GlobalErrorHandler implements ErrorWebExceptionHandler {

    static final String INTERNAL_MESSAGE = "An unexpected error occurred";

    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final ResponseEnvelope envelope;
    private final Clock clock;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.error(ex);
        }

        HttpStatusCode status;
        ErrorCode code;
        String message;
        Map<String, Object> details = new LinkedHashMap<>();

        if (ex instanceof GatewayException) {
            GatewayException gatewayException = (GatewayException) ex;
            code = gatewayException.getErrorCode();
            status = code.getStatus();
            message = gatewayException instanceof InternalGatewayException ? INTERNAL_MESSAGE : ex.getMessage();
            details.putAll(gatewayException.getDetails());
            if (gatewayException instanceof RateLimitExceededException) {
                applyRateLimitHeaders(response.getHeaders(), (RateLimitExceededException) gatewayException);
            }
        } else if (ex instanceof ResponseStatusException) {
            ResponseStatusException statusException = (ResponseStatusException) ex;
            status = statusException.getStatusCode();
            code = ErrorCode.fromStatus(status.value());
            message = status.is5xxServerError() ? INTERNAL_MESSAGE : reason(statusException);
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            code = ErrorCode.INTERNAL_ERROR;
            message = INTERNAL_MESSAGE;
        }

        String requestId = RequestContext.requestId(exchange);
        String path = exchange.getRequest().getPath().value();
        if (status.is5xxServerError()) {
            log.error("Request {} {} failed with {} [{}]: {}", exchange.getRequest().getMethod(), path,
                    status.value(), requestId, ex.getMessage(), ex);
        } else {
            log.debug("Request {} {} rejected with {} [{}]: {}", exchange.getRequest().getMethod(), path,
                    status.value(), requestId, ex.getMessage());
        }

        Map<String, Object> exposedDetails = null;
        if (properties.isDiagnosticsEnabled()) {
            details.put("exception", ex.getClass().getName());
            if (ex.getCause() != null) {
                details.put("cause", ex.getCause().getClass().getSimpleName() + ": " + ex.getCause().getMessage());
            }
            details.put("path", path);
            exposedDetails = details;
        }

        ApiResponse<Void> body = envelope.stamp(ApiResponse.failure(code.name(), message, exposedDetails), exchange);
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        DataBufferFactory bufferFactory = response.bufferFactory();
        DataBuffer buffer;
        try {
            buffer = bufferFactory.wrap(objectMapper.writeValueAsBytes(body));
        } catch (JsonProcessingException e) {
            log.error("Error writing error response as JSON", e);
            buffer = bufferFactory.wrap(("{\"success\":false,\"error\":{\"code\":\"" + code.name() + "\"}}")
                    .getBytes(StandardCharsets.UTF_8));
        }
        return response.writeWith(Mono.just(buffer));
    }

    private void applyRateLimitHeaders(HttpHeaders headers, RateLimitExceededException ex) {
        ProxyHeaders.applyRateLimit(headers, ex.getDecision());
        long retryAfterMillis = ex.getDecision().getResetTime() - clock.millis();
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, (retryAfterMillis + 999) / 1000)));
    }

    private static String reason(ResponseStatusException ex) {
        if (ex.getReason() != null) {
            return ex.getReason();
        }
        HttpStatus resolved = HttpStatus.resolve(ex.getStatusCode().value());
        return resolved == null ? "Request failed" : resolved.getReasonPhrase();
    }
}

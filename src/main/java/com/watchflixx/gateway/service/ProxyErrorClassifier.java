package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.client.UpstreamException;
import com.watchflixx.gateway.error.BadGatewayException;
import com.watchflixx.gateway.error.GatewayException;
import com.watchflixx.gateway.error.GatewayTimeoutException;
import com.watchflixx.gateway.error.InternalGatewayException;
import com.watchflixx.gateway.error.ServiceUnavailableException;

import java.util.concurrent.TimeoutException;

/**
 * 把代理过程中的任意失败映射为对外错误，原始传输异常不会直接返回给调用方
 *
 * <ul>
 *   <li>后端 5xx（重试耗尽）→ 502</li>
 *   <li>超时 → 504</li>
 *   <li>拒绝连接、DNS、连接重置等 → 503</li>
 *   <li>熔断器打开、无健康端点 → 503（已是 {@link GatewayException}，原样返回）</li>
 *   <li>其他 → 500</li>
 * </ul>
 */
public class ProxyErrorClassifier {

    public GatewayException classify(Throwable error, String serviceName) {
        if (error instanceof GatewayException) {
            return (GatewayException) error;
        }
        String service = serviceName == null ? "Upstream" : serviceName;
        if (error instanceof UpstreamException) {
            UpstreamException upstream = (UpstreamException) error;
            switch (upstream.getKind()) {
                case SERVER_ERROR:
                    return new BadGatewayException(service + " service returned an error", error)
                            .withDetail("upstreamStatus", upstream.getStatusCode())
                            .withDetail("endpoint", upstream.getEndpointUrl());
                case TIMEOUT:
                    return new GatewayTimeoutException(service + " service request timed out", error)
                            .withDetail("endpoint", upstream.getEndpointUrl());
                default:
                    return new ServiceUnavailableException(service + " service is temporarily unavailable", error)
                            .withDetail("reason", upstream.getKind().name())
                            .withDetail("endpoint", upstream.getEndpointUrl());
            }
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException(service + " service request timed out", error);
        }
        return new InternalGatewayException("Unexpected proxy failure", error);
    }
}

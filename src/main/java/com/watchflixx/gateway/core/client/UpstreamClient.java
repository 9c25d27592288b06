package com.watchflixx.gateway.core.client;

import com.watchflixx.gateway.core.model.Endpoint;
import reactor.core.publisher.Mono;

/**
 * 向单个端点发起一次 HTTP 调用
 *
 * <p>实现只负责传输：不重试、不判断健康。任何 HTTP 状态码都以正常响应返回，
 * 传输层失败以错误信号返回，由负载均衡器统一分类。
 */
public interface UpstreamClient {

    Mono<UpstreamResponse> send(Endpoint endpoint, UpstreamRequest request);

    /**
     * 端点被移除时释放其连接资源
     */
    default void release(Endpoint endpoint) {
    }
}

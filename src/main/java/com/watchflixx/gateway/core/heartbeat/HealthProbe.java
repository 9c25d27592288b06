package com.watchflixx.gateway.core.heartbeat;

import com.watchflixx.gateway.core.model.Endpoint;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 对单个端点执行一次存活探测
 */
public interface HealthProbe {

    /**
     * @param healthPath 健康检查路径，例如 /health
     * @param timeout    探测超时，超时视为不健康
     * @return 探测结果，不以错误信号结束
     */
    Mono<ProbeResult> probe(Endpoint endpoint, String healthPath, Duration timeout);
}

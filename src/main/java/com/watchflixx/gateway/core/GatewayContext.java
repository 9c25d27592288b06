package com.watchflixx.gateway.core;

import com.watchflixx.gateway.core.balancer.LoadBalancerRegistry;
import com.watchflixx.gateway.core.breaker.CircuitBreakerRegistry;
import com.watchflixx.gateway.core.metrics.MetricsAggregator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * 网关运行时上下文
 *
 * <p>持有负载均衡器注册表、熔断器注册表和指标聚合器，启动时构建一次，
 * 以引用方式传给代理服务、管理接口和健康探测器。同一进程中可以存在多个互不影响的上下文。
 */
@Getter
@RequiredArgsConstructor
public class GatewayContext {
    private final LoadBalancerRegistry loadBalancers;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MetricsAggregator metrics;
    private final Clock clock;
}

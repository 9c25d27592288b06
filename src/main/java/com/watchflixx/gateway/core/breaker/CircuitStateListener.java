package com.watchflixx.gateway.core.breaker;

/**
 * 熔断器状态变更回调
 *
 * <p>在状态迁移时由熔断器同步调用（持有熔断器内部锁），实现必须快速返回且不能回调熔断器。
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(String serviceName, CircuitState from, CircuitState to);

    CircuitStateListener NO_OP = (serviceName, from, to) -> { };
}

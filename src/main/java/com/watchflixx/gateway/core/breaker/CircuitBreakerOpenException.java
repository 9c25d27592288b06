package com.watchflixx.gateway.core.breaker;

import com.watchflixx.gateway.error.ServiceUnavailableException;

import java.time.Instant;

/**
 * 熔断器拒绝调用，被保护的函数没有被执行
 */
public class CircuitBreakerOpenException extends ServiceUnavailableException {
    private final String serviceName;
    private final Instant nextRetryTime;

    public CircuitBreakerOpenException(String serviceName, Instant nextRetryTime) {
        super(serviceName + " service is temporarily unavailable");
        this.serviceName = serviceName;
        this.nextRetryTime = nextRetryTime;
        withDetail("circuitBreaker", "OPEN");
        if (nextRetryTime != null) {
            withDetail("nextRetryTime", nextRetryTime.toString());
        }
    }

    public String getServiceName() {
        return serviceName;
    }

    public Instant getNextRetryTime() {
        return nextRetryTime;
    }
}

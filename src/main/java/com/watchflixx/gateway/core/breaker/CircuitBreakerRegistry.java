package com.watchflixx.gateway.core.breaker;

import com.watchflixx.gateway.dto.CircuitBreakerStatusDto;
import com.watchflixx.gateway.error.NotFoundException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按后端服务名管理熔断器，首次使用时创建
 *
 * <p>同一个服务名在进程内只会有一个熔断器实例，所有请求共享其状态。
 */
public class CircuitBreakerRegistry {
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerSettings defaultSettings;
    private final Map<String, CircuitBreakerSettings> overrides;
    private final Clock clock;
    private final CircuitStateListener listener;

    public CircuitBreakerRegistry(CircuitBreakerSettings defaultSettings,
                                  Map<String, CircuitBreakerSettings> overrides,
                                  Clock clock,
                                  CircuitStateListener listener) {
        this.defaultSettings = defaultSettings.copy();
        this.overrides = overrides == null ? new HashMap<>() : new HashMap<>(overrides);
        this.clock = clock;
        this.listener = listener;
    }

    public CircuitBreaker getOrCreate(String serviceName) {
        return breakers.computeIfAbsent(serviceName, name ->
                new CircuitBreaker(name, overrides.getOrDefault(name, defaultSettings), clock, listener));
    }

    public Optional<CircuitBreaker> find(String serviceName) {
        return Optional.ofNullable(breakers.get(serviceName));
    }

    public CircuitBreaker require(String serviceName) {
        return find(serviceName)
                .orElseThrow(() -> new NotFoundException("No circuit breaker for service " + serviceName));
    }

    public List<CircuitBreakerStatusDto> snapshots() {
        List<CircuitBreakerStatusDto> result = new ArrayList<>();
        for (CircuitBreaker breaker : breakers.values()) {
            result.add(breaker.snapshot());
        }
        result.sort(Comparator.comparing(CircuitBreakerStatusDto::getServiceName));
        return result;
    }

    public Map<String, CircuitState> states() {
        Map<String, CircuitState> result = new HashMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.getState()));
        return result;
    }
}

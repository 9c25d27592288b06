package com.watchflixx.gateway.core.rate;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 进程内固定窗口计数
 *
 * <p>按 key 使用 {@link ConcurrentHashMap#compute} 保证单个 key 上的自增与窗口重置是原子的，
 * 不同 key 之间互不阻塞。过期窗口在写入量累计到一定程度后顺带清理。
 */
@Slf4j
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final int SWEEP_EVERY = 1024;

    private final Map<String, WindowCount> counters = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong(0);
    private final Clock clock;

    public InMemoryRateLimitStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WindowCount increment(String key, Duration window) {
        long now = clock.millis();
        WindowCount updated = counters.compute(key, (k, current) -> {
            if (current == null || now >= current.getResetTime()) {
                return new WindowCount(1, now + window.toMillis());
            }
            return new WindowCount(current.getCount() + 1, current.getResetTime());
        });
        if (writes.incrementAndGet() % SWEEP_EVERY == 0) {
            evictExpired();
        }
        return updated;
    }

    public int evictExpired() {
        long now = clock.millis();
        int before = counters.size();
        counters.entrySet().removeIf(entry -> now >= entry.getValue().getResetTime());
        int evicted = before - counters.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired rate limit windows", evicted);
        }
        return evicted;
    }

    public int size() {
        return counters.size();
    }
}

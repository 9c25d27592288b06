package com.watchflixx.gateway.service;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 飞行中代理请求跟踪器
 */
public class InflightRequestTracker {
    private final AtomicInteger inflight = new AtomicInteger(0);
    private final AtomicLong peak = new AtomicLong(0);

    public void onStart() {
        int current = inflight.incrementAndGet();
        peak.accumulateAndGet(current, Math::max);
    }

    /**
     * 请求结束，计数不会低于 0
     */
    public void onEnd() {
        int v;
        do {
            v = inflight.get();
            if (v <= 0) {
                return;
            }
        } while (!inflight.compareAndSet(v, v - 1));
    }

    public int inflight() {
        return inflight.get();
    }

    public long peak() {
        return peak.get();
    }
}

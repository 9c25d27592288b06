package com.watchflixx.gateway.core.rate;

import lombok.Value;

/**
 * 一次限流检查的结果
 */
@Value
public class RateLimitDecision {
    boolean allowed;
    int limit;
    int remaining;
    /** 当前窗口结束时间（epoch 毫秒） */
    long resetTime;

    /** X-RateLimit-Reset 使用秒级时间戳 */
    public long resetEpochSeconds() {
        return (resetTime + 999) / 1000;
    }
}

package com.watchflixx.gateway.core.rate;

import java.time.Duration;

/**
 * 固定窗口计数存储
 */
public interface RateLimitStore {

    /**
     * 原子地把 key 的计数加一；如果这是窗口内的第一次自增，同时把过期时间设为 window
     */
    WindowCount increment(String key, Duration window);

    /**
     * 存储访问会阻塞调用线程时返回 true，调用方需要切换到弹性线程池
     */
    default boolean isBlocking() {
        return false;
    }
}

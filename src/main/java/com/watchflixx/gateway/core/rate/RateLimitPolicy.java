package com.watchflixx.gateway.core.rate;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 限流策略，启动时由配置解析得到，所有字段均为最终生效值
 */
@Value
@Builder(toBuilder = true)
public class RateLimitPolicy {
    String name;
    Duration window;
    int maxRequests;
    @Builder.Default
    KeyStrategy keyStrategy = KeyStrategy.CALLER;
    /** 按订阅套餐替换配额 */
    boolean subscriptionTiered;
    @Builder.Default
    String message = "Too many requests, please try again later";
}

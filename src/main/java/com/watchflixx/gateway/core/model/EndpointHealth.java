package com.watchflixx.gateway.core.model;

import lombok.Value;

import java.time.Instant;

/**
 * 端点健康快照（不可变）
 *
 * <p>每次探测结果或请求中的失败分类都会生成一个新的快照，整体替换旧值，
 * 因此读取方看到的状态、延迟、检查时间和错误信息始终来自同一次观测。
 */
@Value
public class EndpointHealth {
    HealthStatus status;
    /** 最近一次探测的响应耗时（毫秒），未知时为 null */
    Long responseTimeMs;
    /** 最近一次检查时间，未检查时为 null */
    Instant lastChecked;
    /** 最近一次错误描述 */
    String lastError;

    public static EndpointHealth unknown() {
        return new EndpointHealth(HealthStatus.UNKNOWN, null, null, null);
    }

    public static EndpointHealth healthy(long responseTimeMs, Instant checkedAt) {
        return new EndpointHealth(HealthStatus.HEALTHY, responseTimeMs, checkedAt, null);
    }

    public static EndpointHealth unhealthy(String error, Long responseTimeMs, Instant checkedAt) {
        return new EndpointHealth(HealthStatus.UNHEALTHY, responseTimeMs, checkedAt, error);
    }
}

package com.watchflixx.gateway.core.heartbeat;

import lombok.Value;

/**
 * 一次健康探测的结果
 */
@Value
public class ProbeResult {
    boolean healthy;
    /** 后端返回的状态码，未收到响应时为 null */
    Integer statusCode;
    long responseTimeMs;
    String error;

    public static ProbeResult healthy(int statusCode, long responseTimeMs) {
        return new ProbeResult(true, statusCode, responseTimeMs, null);
    }

    public static ProbeResult unhealthy(Integer statusCode, long responseTimeMs, String error) {
        return new ProbeResult(false, statusCode, responseTimeMs, error);
    }
}

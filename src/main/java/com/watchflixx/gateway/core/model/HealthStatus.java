package com.watchflixx.gateway.core.model;

/**
 * 端点健康状态
 */
public enum HealthStatus {
    /** 尚未探测 */
    UNKNOWN,
    HEALTHY,
    UNHEALTHY;

    public String label() {
        return name().toLowerCase();
    }
}

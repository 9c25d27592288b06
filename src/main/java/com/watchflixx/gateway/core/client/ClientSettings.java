package com.watchflixx.gateway.core.client;

import java.time.Duration;

/**
 * 上游 HTTP 客户端配置，每个端点独立连接池
 */
public class ClientSettings {
    private int maxConnectionsPerEndpoint;
    private Duration connectTimeout;
    private Duration maxIdleTime;
    private Duration maxLifeTime;
    private Duration pendingAcquireTimeout;
    /** 响应体内存上限（字节） */
    private int maxInMemorySize;

    public static ClientSettings defaultSettings() {
        ClientSettings settings = new ClientSettings();
        settings.setMaxConnectionsPerEndpoint(100);
        settings.setConnectTimeout(Duration.ofSeconds(5));
        settings.setMaxIdleTime(Duration.ofSeconds(20));
        settings.setMaxLifeTime(Duration.ofMinutes(10));
        settings.setPendingAcquireTimeout(Duration.ofSeconds(5));
        settings.setMaxInMemorySize(10 * 1024 * 1024);
        return settings;
    }

    public int getMaxConnectionsPerEndpoint() {
        return maxConnectionsPerEndpoint;
    }

    public void setMaxConnectionsPerEndpoint(int maxConnectionsPerEndpoint) {
        this.maxConnectionsPerEndpoint = Math.max(1, Math.min(1000, maxConnectionsPerEndpoint));
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = positiveOr(connectTimeout, Duration.ofSeconds(5));
    }

    public Duration getMaxIdleTime() {
        return maxIdleTime;
    }

    public void setMaxIdleTime(Duration maxIdleTime) {
        this.maxIdleTime = positiveOr(maxIdleTime, Duration.ofSeconds(20));
    }

    public Duration getMaxLifeTime() {
        return maxLifeTime;
    }

    public void setMaxLifeTime(Duration maxLifeTime) {
        this.maxLifeTime = positiveOr(maxLifeTime, Duration.ofMinutes(10));
    }

    public Duration getPendingAcquireTimeout() {
        return pendingAcquireTimeout;
    }

    public void setPendingAcquireTimeout(Duration pendingAcquireTimeout) {
        this.pendingAcquireTimeout = positiveOr(pendingAcquireTimeout, Duration.ofSeconds(5));
    }

    public int getMaxInMemorySize() {
        return maxInMemorySize;
    }

    public void setMaxInMemorySize(int maxInMemorySize) {
        this.maxInMemorySize = Math.max(256 * 1024, maxInMemorySize);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return (value == null || value.isNegative() || value.isZero()) ? fallback : value;
    }
}

package com.watchflixx.gateway.core.balancer;

import java.time.Duration;

/**
 * 负载均衡配置
 *
 * <p>主要配置项：
 * <ul>
 *   <li><b>策略</b>：轮询、最少连接、加权随机、随机</li>
 *   <li><b>重试</b>：重试次数与指数退避的基础间隔</li>
 *   <li><b>健康检查</b>：探测间隔、超时与探测路径</li>
 * </ul>
 *
 * <p>所有参数都有默认值，并通过 setter 方法进行范围校验和修正。
 */
public class LoadBalancingSettings {
    private LoadBalancingStrategy strategy;
    /** 首次调用之外的最大重试次数 */
    private int retryAttempts;
    /** 退避基础间隔，第 n 次重试前等待 retryDelay * 2^n */
    private Duration retryDelay;
    private Duration healthCheckInterval;
    private Duration healthCheckTimeout;
    private String healthPath;

    public static LoadBalancingSettings defaultSettings() {
        LoadBalancingSettings settings = new LoadBalancingSettings();
        settings.setStrategy(LoadBalancingStrategy.ROUND_ROBIN);
        settings.setRetryAttempts(3);
        settings.setRetryDelay(Duration.ofSeconds(1));
        settings.setHealthCheckInterval(Duration.ofSeconds(30));
        settings.setHealthCheckTimeout(Duration.ofSeconds(5));
        settings.setHealthPath("/health");
        return settings;
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(LoadBalancingStrategy strategy) {
        this.strategy = strategy == null ? LoadBalancingStrategy.ROUND_ROBIN : strategy;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = Math.max(0, Math.min(10, retryAttempts));
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = (retryDelay == null || retryDelay.isNegative()) ? Duration.ZERO : retryDelay;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    /** 探测间隔下限 1 秒 */
    public void setHealthCheckInterval(Duration healthCheckInterval) {
        if (healthCheckInterval == null || healthCheckInterval.compareTo(Duration.ofSeconds(1)) < 0) {
            this.healthCheckInterval = Duration.ofSeconds(1);
        } else {
            this.healthCheckInterval = healthCheckInterval;
        }
    }

    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }

    public void setHealthCheckTimeout(Duration healthCheckTimeout) {
        if (healthCheckTimeout == null || healthCheckTimeout.isNegative() || healthCheckTimeout.isZero()) {
            this.healthCheckTimeout = Duration.ofSeconds(5);
        } else {
            this.healthCheckTimeout = healthCheckTimeout;
        }
    }

    public String getHealthPath() {
        return healthPath;
    }

    public void setHealthPath(String healthPath) {
        if (healthPath == null || healthPath.isBlank()) {
            this.healthPath = "/health";
        } else {
            String trimmed = healthPath.trim();
            this.healthPath = trimmed.startsWith("/") ? trimmed : "/" + trimmed;
        }
    }

    public LoadBalancingSettings copy() {
        LoadBalancingSettings copy = new LoadBalancingSettings();
        copy.setStrategy(this.strategy);
        copy.setRetryAttempts(this.retryAttempts);
        copy.setRetryDelay(this.retryDelay);
        copy.setHealthCheckInterval(this.healthCheckInterval);
        copy.setHealthCheckTimeout(this.healthCheckTimeout);
        copy.setHealthPath(this.healthPath);
        return copy;
    }
}

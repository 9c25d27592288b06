package com.watchflixx.gateway.core.breaker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 熔断器配置
 *
 * <p>所有参数都有默认值，setter 会把非法值修正到合法范围。
 */
public class CircuitBreakerSettings {
    /** 连续失败多少次后打开熔断器 */
    private int failureThreshold;
    /** 打开后多久允许一次试探调用 */
    private Duration resetTimeout;
    /** 单次受保护调用（含负载均衡重试）的总超时，0 表示不限制 */
    private Duration callTimeout;
    /** 错误信息包含这些片段时视为调用方问题，不计入失败 */
    private List<String> expectedErrors;

    public static CircuitBreakerSettings defaultSettings() {
        CircuitBreakerSettings settings = new CircuitBreakerSettings();
        settings.setFailureThreshold(5);
        settings.setResetTimeout(Duration.ofSeconds(30));
        settings.setCallTimeout(Duration.ofSeconds(60));
        settings.setExpectedErrors(new ArrayList<>());
        return settings;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = Math.max(1, failureThreshold);
    }

    public Duration getResetTimeout() {
        return resetTimeout;
    }

    public void setResetTimeout(Duration resetTimeout) {
        this.resetTimeout = (resetTimeout == null || resetTimeout.isNegative()) ? Duration.ofSeconds(30) : resetTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = (callTimeout == null || callTimeout.isNegative()) ? Duration.ZERO : callTimeout;
    }

    public List<String> getExpectedErrors() {
        return expectedErrors;
    }

    public void setExpectedErrors(List<String> expectedErrors) {
        this.expectedErrors = expectedErrors == null ? new ArrayList<>() : new ArrayList<>(expectedErrors);
    }

    public CircuitBreakerSettings copy() {
        CircuitBreakerSettings copy = new CircuitBreakerSettings();
        copy.setFailureThreshold(this.failureThreshold);
        copy.setResetTimeout(this.resetTimeout);
        copy.setCallTimeout(this.callTimeout);
        copy.setExpectedErrors(this.expectedErrors);
        return copy;
    }
}

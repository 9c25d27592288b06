package com.watchflixx.gateway.core.metrics;

import java.time.Duration;

/**
 * 指标聚合配置
 */
public class MetricsSettings {
    /** 内存中最多保留的请求记录数 */
    private int maxHistory;
    /** 记录保留时长 */
    private Duration retention;
    /** 聚合统计的默认时间窗口 */
    private Duration window;
    /** 清理任务的执行间隔 */
    private Duration compactionInterval;

    public static MetricsSettings defaultSettings() {
        MetricsSettings settings = new MetricsSettings();
        settings.setMaxHistory(10000);
        settings.setRetention(Duration.ofHours(24));
        settings.setWindow(Duration.ofHours(1));
        settings.setCompactionInterval(Duration.ofMinutes(1));
        return settings;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = Math.max(1, maxHistory);
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = (retention == null || retention.compareTo(Duration.ofSeconds(1)) < 0)
                ? Duration.ofSeconds(1) : retention;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = (window == null || window.compareTo(Duration.ofMinutes(1)) < 0)
                ? Duration.ofMinutes(1) : window;
    }

    public Duration getCompactionInterval() {
        return compactionInterval;
    }

    public void setCompactionInterval(Duration compactionInterval) {
        this.compactionInterval = (compactionInterval == null || compactionInterval.compareTo(Duration.ofSeconds(1)) < 0)
                ? Duration.ofSeconds(1) : compactionInterval;
    }
}

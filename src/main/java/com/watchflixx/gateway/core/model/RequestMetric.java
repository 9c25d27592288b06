package com.watchflixx.gateway.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 单次已完成请求的指标记录（不可变）
 */
@Value
@Builder
public class RequestMetric {
    /** 完成时间（epoch 毫秒） */
    long timestamp;
    String method;
    /** 归一化后的路径，路径参数已替换为占位符 */
    String path;
    int statusCode;
    long responseTimeMs;
    /** 代理到的后端服务名，未代理时为 null */
    String serviceName;
    /** 已认证调用方 ID，匿名时为 null */
    String userId;

    public boolean isError() {
        return statusCode >= 400;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}

package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.Map;

/**
 * 时间窗口内的聚合指标
 */
@Data
@Schema(description = "聚合指标")
public class AggregatedMetricsDto {

    @Schema(description = "统计窗口（毫秒）")
    private Long windowMs;

    @Schema(description = "请求数")
    private Long requestCount;

    @Schema(description = "错误数（状态码 >= 400）")
    private Long errorCount;

    @Schema(description = "错误率（百分比）")
    private Double errorRate;

    @Schema(description = "响应耗时")
    private ResponseTimeDto responseTime;

    @Schema(description = "状态码分类计数，例如 2xx / 4xx / 5xx")
    private Map<String, Long> statusCodes;

    @Schema(description = "按后端服务拆分")
    private Map<String, ServiceBreakdownDto> services;
}

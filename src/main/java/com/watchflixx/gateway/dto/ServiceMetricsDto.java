package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.Map;

@Data
@Schema(description = "单个后端服务的指标（全部保留历史）")
public class ServiceMetricsDto {

    @Schema(description = "后端服务名")
    private String serviceName;

    @Schema(description = "请求数")
    private Long requestCount;

    @Schema(description = "错误数")
    private Long errorCount;

    @Schema(description = "响应耗时")
    private ResponseTimeDto responseTime;

    @Schema(description = "状态码计数")
    private Map<String, Long> statusCodes;

    @Schema(description = "最近一次请求时间（ISO-8601）")
    private String lastRequestTime;

    @Schema(description = "可用率：状态码 < 500 的请求占比（百分比）")
    private Double uptime;
}

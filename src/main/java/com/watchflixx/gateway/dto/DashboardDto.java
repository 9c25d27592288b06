package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

/**
 * 运维看板一次性拉取的全部数据
 */
@Data
@Schema(description = "运维看板")
public class DashboardDto {

    @Schema(description = "窗口内聚合指标")
    private AggregatedMetricsDto overview;

    @Schema(description = "综合健康评分")
    private HealthScoreDto healthScore;

    @Schema(description = "各服务健康状态")
    private List<ServiceHealthDto> services;

    @Schema(description = "熔断器状态")
    private List<CircuitBreakerStatusDto> circuitBreakers;

    @Schema(description = "最近一小时流量分布")
    private List<TrafficBucketDto> trafficPatterns;

    @Schema(description = "最慢的接口")
    private List<SlowEndpointDto> slowEndpoints;

    @Schema(description = "错误分布")
    private ErrorDistributionDto errorDistribution;

    @Schema(description = "进程信息")
    private SystemInfoDto system;
}

package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

/**
 * 服务池负载均衡统计
 */
@Data
@Schema(description = "服务池负载均衡统计")
public class PoolStatsDto {

    @Schema(description = "后端服务名")
    private String serviceName;

    @Schema(description = "负载均衡策略")
    private String strategy;

    @Schema(description = "端点总数")
    private Integer totalEndpoints;

    @Schema(description = "健康端点数")
    private Integer healthyEndpoints;

    @Schema(description = "所有端点当前连接数之和")
    private Integer totalConnections;

    @Schema(description = "最近一次探测的平均耗时（毫秒）")
    private Double averageResponseTime;

    @Schema(description = "最近一次健康检查时间（ISO-8601）")
    private String lastHealthCheck;

    @Schema(description = "端点明细")
    private List<EndpointStatusDto> endpoints;
}

package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

/**
 * 单个后端服务的健康视图：端点健康 + 熔断状态
 */
@Data
@Schema(description = "后端服务健康状态")
public class ServiceHealthDto {

    @Schema(description = "后端服务名")
    private String serviceName;

    @Schema(description = "healthy / degraded / unhealthy")
    private String status;

    @Schema(description = "熔断器状态，未创建熔断器时为空")
    private String circuitState;

    @Schema(description = "端点健康汇总")
    private HealthSummaryDto summary;

    @Schema(description = "最近一次健康检查时间（ISO-8601）")
    private String lastHealthCheck;

    @Schema(description = "端点明细")
    private List<EndpointStatusDto> endpoints;
}

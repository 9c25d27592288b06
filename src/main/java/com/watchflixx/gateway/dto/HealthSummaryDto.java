package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 服务池健康汇总
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "服务池健康汇总")
public class HealthSummaryDto {

    @Schema(description = "端点总数")
    private Integer total;

    @Schema(description = "健康端点数")
    private Integer healthy;

    @Schema(description = "不健康端点数")
    private Integer unhealthy;

    @Schema(description = "尚未探测的端点数")
    private Integer unknown;

    @Schema(description = "健康端点占比（百分比）")
    private Double healthyPercentage;
}

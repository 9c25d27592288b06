package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "熔断器状态")
public class CircuitBreakerStatusDto {

    @Schema(description = "后端服务名")
    private String serviceName;

    @Schema(description = "当前状态：CLOSED / OPEN / HALF_OPEN")
    private String state;

    @Schema(description = "失败计数")
    private Integer failureCount;

    @Schema(description = "成功计数")
    private Integer successCount;

    @Schema(description = "最近一次失败时间（ISO-8601）")
    private String lastFailureTime;

    @Schema(description = "允许下一次试探调用的时间（ISO-8601）")
    private String nextRetryTime;

    @Schema(description = "可用率（百分比），无调用时为 100")
    private Double uptime;

    @Schema(description = "打开阈值")
    private Integer failureThreshold;
}

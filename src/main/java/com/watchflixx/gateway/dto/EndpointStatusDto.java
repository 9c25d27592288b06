package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "端点状态")
public class EndpointStatusDto {

    @Schema(description = "端点 ID")
    private String id;

    @Schema(description = "端点基础地址")
    private String url;

    @Schema(description = "权重")
    private Integer weight;

    @Schema(description = "健康状态：unknown / healthy / unhealthy")
    private String status;

    @Schema(description = "当前连接数")
    private Integer currentConnections;

    @Schema(description = "最近一次探测耗时（毫秒）")
    private Long responseTimeMs;

    @Schema(description = "最近一次检查时间（ISO-8601）")
    private String lastChecked;

    @Schema(description = "最近一次错误")
    private String lastError;
}

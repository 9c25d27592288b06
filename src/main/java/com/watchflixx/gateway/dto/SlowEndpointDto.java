package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "慢接口排行项")
public class SlowEndpointDto {

    @Schema(description = "METHOD + 归一化路径")
    private String endpoint;

    @Schema(description = "平均耗时（毫秒）")
    private Long averageResponseTime;

    @Schema(description = "请求数")
    private Long requestCount;
}

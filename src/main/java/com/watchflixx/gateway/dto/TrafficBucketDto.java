package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "5 分钟流量桶")
public class TrafficBucketDto {

    @Schema(description = "桶起始时间（ISO-8601）")
    private String timestamp;

    @Schema(description = "请求数")
    private Long requestCount;

    @Schema(description = "错误数")
    private Long errorCount;

    @Schema(description = "平均耗时（毫秒）")
    private Long averageResponseTime;
}

package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "响应耗时统计（毫秒）")
public class ResponseTimeDto {

    @Schema(description = "平均值")
    private Long average;

    @Schema(description = "中位数")
    private Long p50;

    @Schema(description = "95 分位")
    private Long p95;

    @Schema(description = "99 分位")
    private Long p99;
}

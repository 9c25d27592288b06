package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "单个后端服务在统计窗口内的请求概况")
public class ServiceBreakdownDto {

    @Schema(description = "请求数")
    private Long requestCount;

    @Schema(description = "错误数（状态码 >= 400）")
    private Long errorCount;

    @Schema(description = "平均耗时（毫秒）")
    private Long averageResponseTime;
}

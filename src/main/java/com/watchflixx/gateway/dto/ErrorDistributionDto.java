package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.Map;

@Data
@Schema(description = "错误分布")
public class ErrorDistributionDto {

    @Schema(description = "错误总数")
    private Long total;

    @Schema(description = "按状态码")
    private Map<String, Long> byStatus;

    @Schema(description = "按 METHOD + 路径，取前 10")
    private Map<String, Long> byPath;

    @Schema(description = "按后端服务")
    private Map<String, Long> byService;
}

package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "调整端点权重请求")
public class UpdateWeightRequest {

    @Schema(description = "端点基础 URL", example = "http://localhost:3011")
    private String url;

    @Schema(description = "新权重，最小为 1", example = "3")
    private Integer weight;
}

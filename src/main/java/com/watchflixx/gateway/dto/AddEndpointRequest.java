package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "新增端点请求")
public class AddEndpointRequest {

    @Schema(description = "端点基础 URL", example = "http://localhost:3011")
    private String url;

    @Schema(description = "权重，默认 1", example = "1")
    private Integer weight;
}

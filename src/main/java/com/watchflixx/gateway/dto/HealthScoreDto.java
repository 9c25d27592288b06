package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Schema(description = "综合健康评分")
public class HealthScoreDto {

    @Schema(description = "0-100 的综合评分")
    private Integer score;

    @Schema(description = "healthy / degraded / unhealthy")
    private String status;

    @Schema(description = "各因子明细")
    private List<Factor> factors;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "评分因子")
    public static class Factor {
        @Schema(description = "因子名")
        private String name;
        @Schema(description = "原始值")
        private Double value;
        @Schema(description = "归一化到 0-100 后的影响值")
        private Double impact;
        @Schema(description = "权重")
        private Integer weight;
    }
}

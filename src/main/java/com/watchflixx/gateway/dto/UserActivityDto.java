package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Schema(description = "用户活跃度")
public class UserActivityDto {

    @Schema(description = "窗口内活跃用户数")
    private Integer activeUsers;

    @Schema(description = "已认证请求总数")
    private Long totalRequests;

    @Schema(description = "请求最多的前 10 个用户")
    private List<UserRequestCount> topUsers;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "用户请求数")
    public static class UserRequestCount {
        private String userId;
        private Long requestCount;
    }
}

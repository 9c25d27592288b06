package com.watchflixx.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 网关自身接口（管理、健康、错误）的统一响应信封，代理响应不包装
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "统一响应信封")
public class ApiResponse<T> {

    @Schema(description = "是否成功")
    private boolean success;

    @Schema(description = "业务数据")
    private T data;

    @Schema(description = "错误信息，成功时为空")
    private ErrorBody error;

    @Schema(description = "附加说明")
    private String message;

    @Schema(description = "响应时间（ISO-8601）")
    private String timestamp;

    @Schema(description = "请求 ID")
    private String requestId;

    @Schema(description = "API 版本")
    private String version;

    public static <T> ApiResponse<T> ok(T data) {
        ApiResponse<T> response = new ApiResponse<>();
        response.setSuccess(true);
        response.setData(data);
        return response;
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        ApiResponse<T> response = ok(data);
        response.setMessage(message);
        return response;
    }

    public static ApiResponse<Void> failure(String code, String message, Map<String, Object> details) {
        ApiResponse<Void> response = new ApiResponse<>();
        response.setSuccess(false);
        response.setError(new ErrorBody(code, message, details));
        return response;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @Schema(description = "错误详情")
    public static class ErrorBody {
        @Schema(description = "错误码，例如 RATE_LIMIT_ERROR")
        private String code;
        @Schema(description = "错误描述")
        private String message;
        @Schema(description = "结构化补充信息")
        private Map<String, Object> details;
    }
}

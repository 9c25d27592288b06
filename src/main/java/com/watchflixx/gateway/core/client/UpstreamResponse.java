package com.watchflixx.gateway.core.client;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;

/**
 * 后端响应，网关只关心状态码和耗时，响应体原样透传
 */
@Value
@Builder
public class UpstreamResponse {
    int statusCode;
    @Builder.Default
    HttpHeaders headers = new HttpHeaders();
    @Builder.Default
    byte[] body = new byte[0];
    long responseTimeMs;
    /** 实际处理请求的端点 */
    String endpointUrl;

    public boolean isServerError() {
        return statusCode >= 500;
    }
}

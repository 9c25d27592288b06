package com.watchflixx.gateway.core.client;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.time.Duration;

/**
 * 发往后端的请求，路径已经过改写，请求头已注入身份与追踪信息
 */
@Value
@Builder(toBuilder = true)
public class UpstreamRequest {
    HttpMethod method;
    /** 改写后的路径，包含查询串 */
    String path;
    @Builder.Default
    HttpHeaders headers = new HttpHeaders();
    byte[] body;
    /** 单次调用超时 */
    Duration timeout;
    String requestId;

    public boolean hasBody() {
        return body != null && body.length > 0;
    }
}

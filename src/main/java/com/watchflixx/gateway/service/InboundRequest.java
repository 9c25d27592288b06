package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.model.CallerIdentity;
import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

/**
 * 进入网关的请求，与具体 Web 框架解耦
 */
@Value
@Builder
public class InboundRequest {
    HttpMethod method;
    String path;
    /** 原始查询串，不含 '?' */
    String query;
    @Builder.Default
    HttpHeaders headers = new HttpHeaders();
    byte[] body;
    String clientAddress;
    String requestId;
    /** 匿名请求为 null */
    CallerIdentity identity;

    public String pathWithQuery(String path) {
        return (query == null || query.isEmpty()) ? path : path + "?" + query;
    }
}

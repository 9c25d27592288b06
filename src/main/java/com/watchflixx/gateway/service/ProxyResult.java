package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.client.UpstreamResponse;
import com.watchflixx.gateway.core.model.RouteDefinition;
import com.watchflixx.gateway.core.rate.RateLimitDecision;
import lombok.Value;

@Value
public class ProxyResult {
    RouteDefinition route;
    UpstreamResponse response;
    /** 路由未配置限流时为 null */
    RateLimitDecision rateLimit;
}

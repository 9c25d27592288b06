package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.model.CallerIdentity;
import com.watchflixx.gateway.core.model.RouteDefinition;
import com.watchflixx.gateway.core.rate.RateLimitDecision;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 代理请求头与响应头的改写规则
 */
public final class ProxyHeaders {

    public static final String GATEWAY_SERVICE = "X-Gateway-Service";
    public static final String REQUEST_ID = "X-Request-ID";
    public static final String FORWARDED_FOR = "X-Forwarded-For";
    public static final String REAL_IP = "X-Real-IP";
    public static final String USER_ID = "X-User-ID";
    public static final String USER_EMAIL = "X-User-Email";
    public static final String PROFILE_ID = "X-Profile-ID";
    public static final String SUBSCRIPTION_PLAN = "X-Subscription-Plan";
    public static final String SUBSCRIPTION_STATUS = "X-Subscription-Status";
    public static final String PROXIED_BY = "X-Proxied-By";
    public static final String SERVICE_NAME = "X-Service-Name";
    public static final String RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";

    public static final String PROXIED_BY_VALUE = "WatchFlixx-Gateway";

    private static final Set<String> HOP_BY_HOP = caseInsensitive(List.of(
            "Connection", "Keep-Alive", "Proxy-Authenticate", "Proxy-Authorization", "TE", "Trailer",
            "Transfer-Encoding", "Upgrade", "Host", "Content-Length"));

    private static final Set<String> IDENTITY = caseInsensitive(List.of(
            USER_ID, USER_EMAIL, PROFILE_ID, SUBSCRIPTION_PLAN, SUBSCRIPTION_STATUS));

    private ProxyHeaders() {
    }

    /**
     * 构造发往后端的请求头：去掉逐跳头和路由声明移除的头，注入追踪、来源和身份信息
     */
    public static HttpHeaders outbound(RouteDefinition route, InboundRequest inbound) {
        Set<String> removed = caseInsensitive(route.getRemoveHeaders());
        HttpHeaders headers = new HttpHeaders();
        inbound.getHeaders().forEach((name, values) -> {
            if (!HOP_BY_HOP.contains(name) && !IDENTITY.contains(name) && !removed.contains(name)) {
                headers.put(name, values);
            }
        });

        headers.set(GATEWAY_SERVICE, route.getServiceName());
        headers.set(REQUEST_ID, inbound.getRequestId());
        String clientAddress = inbound.getClientAddress();
        if (clientAddress != null) {
            String previous = inbound.getHeaders().getFirst(FORWARDED_FOR);
            headers.set(FORWARDED_FOR, previous == null || previous.isBlank() ? clientAddress : previous + ", " + clientAddress);
            headers.set(REAL_IP, clientAddress);
        }

        CallerIdentity identity = inbound.getIdentity();
        if (identity != null) {
            setIfPresent(headers, USER_ID, identity.getUserId());
            setIfPresent(headers, USER_EMAIL, identity.getEmail());
            setIfPresent(headers, PROFILE_ID, identity.getProfileId());
            setIfPresent(headers, SUBSCRIPTION_PLAN, identity.getSubscriptionPlan());
            setIfPresent(headers, SUBSCRIPTION_STATUS, identity.getSubscriptionStatus());
        }
        route.getHeaders().forEach(headers::set);
        return headers;
    }

    /**
     * 构造返回给调用方的响应头
     */
    public static HttpHeaders response(ProxyResult result, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        result.getResponse().getHeaders().forEach((name, values) -> {
            if (!HOP_BY_HOP.contains(name)) {
                headers.put(name, values);
            }
        });
        headers.set(PROXIED_BY, PROXIED_BY_VALUE);
        headers.set(SERVICE_NAME, result.getRoute().getServiceName());
        if (requestId != null) {
            headers.set(REQUEST_ID, requestId);
        }
        applyRateLimit(headers, result.getRateLimit());
        return headers;
    }

    public static void applyRateLimit(HttpHeaders headers, RateLimitDecision decision) {
        if (decision == null) {
            return;
        }
        headers.set(RATE_LIMIT_LIMIT, String.valueOf(decision.getLimit()));
        headers.set(RATE_LIMIT_REMAINING, String.valueOf(decision.getRemaining()));
        headers.set(RATE_LIMIT_RESET, String.valueOf(decision.resetEpochSeconds()));
    }

    private static void setIfPresent(HttpHeaders headers, String name, String value) {
        if (value != null && !value.isBlank()) {
            headers.set(name, value);
        }
    }

    private static Set<String> caseInsensitive(List<String> names) {
        Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(names);
        return set;
    }
}

package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.model.CallerIdentity;
import org.springframework.http.HttpHeaders;

/**
 * 读取前置认证层注入的身份头
 */
public class HeaderCallerIdentityResolver implements CallerIdentityResolver {

    @Override
    public CallerIdentity resolve(HttpHeaders headers) {
        String userId = trimToNull(headers.getFirst(ProxyHeaders.USER_ID));
        if (userId == null) {
            return null;
        }
        String plan = trimToNull(headers.getFirst(ProxyHeaders.SUBSCRIPTION_PLAN));
        String status = trimToNull(headers.getFirst(ProxyHeaders.SUBSCRIPTION_STATUS));
        return CallerIdentity.builder()
                .userId(userId)
                .email(trimToNull(headers.getFirst(ProxyHeaders.USER_EMAIL)))
                .profileId(trimToNull(headers.getFirst(ProxyHeaders.PROFILE_ID)))
                .subscriptionPlan(plan == null ? null : plan.toUpperCase())
                .subscriptionStatus(status == null ? null : status.toUpperCase())
                .build();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

package com.watchflixx.gateway.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 已认证调用方的身份与订阅信息
 *
 * <p>由可信的边缘认证层解析后交给网关，网关只读取不校验。
 */
@Value
@Builder
public class CallerIdentity {
    public static final String STATUS_ACTIVE = "ACTIVE";

    String userId;
    String email;
    String profileId;
    String subscriptionPlan;
    String subscriptionStatus;

    public boolean hasSubscription() {
        return subscriptionPlan != null && !subscriptionPlan.isBlank();
    }

    public boolean hasActiveSubscription() {
        return hasSubscription() && STATUS_ACTIVE.equalsIgnoreCase(subscriptionStatus);
    }

    public boolean hasProfile() {
        return profileId != null && !profileId.isBlank();
    }
}

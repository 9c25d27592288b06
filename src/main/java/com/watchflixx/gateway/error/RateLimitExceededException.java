package com.watchflixx.gateway.error;

import com.watchflixx.gateway.core.rate.RateLimitDecision;

/**
 * 超出限流配额，携带 limit / remaining / reset 供响应头使用
 */
public class RateLimitExceededException extends GatewayException {
    private final RateLimitDecision decision;

    public RateLimitExceededException(String policyName, String message, RateLimitDecision decision) {
        super(ErrorCode.RATE_LIMIT_ERROR, message);
        this.decision = decision;
        withDetail("policy", policyName);
        withDetail("limit", decision.getLimit());
        withDetail("remaining", decision.getRemaining());
        withDetail("resetTime", decision.getResetTime());
    }

    public RateLimitDecision getDecision() {
        return decision;
    }
}

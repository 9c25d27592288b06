package com.watchflixx.gateway.core.rate;

import com.watchflixx.gateway.core.model.CallerIdentity;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按命名策略执行的调用方配额控制
 *
 * <p>每个 (策略名, 调用方键) 独立计数，窗口内第一次请求时开始计时，
 * {@code allowed = count <= limit}。订阅策略在检查前先按调用方套餐替换配额。
 *
 * <p>计数存储异常时放行请求并记录错误，限流不可用不应导致整个网关不可用。
 */
@Slf4j
public class RateLimiter {

    private final RateLimitStore store;
    private final Map<String, RateLimitPolicy> policies;
    private final RateLimitSettings settings;
    private final Clock clock;

    public RateLimiter(RateLimitStore store, RateLimitSettings settings, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(settings.resolvePolicies()));
        this.clock = clock;
    }

    public RateLimitPolicy policy(String policyName) {
        RateLimitPolicy policy = policies.get(policyName);
        if (policy == null) {
            throw new IllegalArgumentException("Unknown rate limit policy: " + policyName);
        }
        return policy;
    }

    public boolean hasPolicy(String policyName) {
        return policies.containsKey(policyName);
    }

    public Map<String, RateLimitPolicy> getPolicies() {
        return policies;
    }

    /**
     * 按策略默认配额检查
     */
    public RateLimitDecision check(String policyName, String callerKey) {
        return check(policyName, callerKey, policy(policyName).getMaxRequests());
    }

    /**
     * 使用指定配额检查，窗口长度仍取自策略
     */
    public RateLimitDecision check(String policyName, String callerKey, int limit) {
        RateLimitPolicy policy = policy(policyName);
        String key = policyName + ":" + callerKey;
        try {
            WindowCount counted = store.increment(key, policy.getWindow());
            boolean allowed = counted.getCount() <= limit;
            int remaining = (int) Math.max(0, limit - counted.getCount());
            if (!allowed) {
                log.warn("Rate limit exceeded: policy={}, key={}, limit={}", policyName, callerKey, limit);
            }
            return new RateLimitDecision(allowed, limit, remaining, counted.getResetTime());
        } catch (RuntimeException e) {
            log.error("Rate limit store failed for policy {} key {}, allowing request", policyName, callerKey, e);
            return new RateLimitDecision(true, limit, limit, clock.millis() + policy.getWindow().toMillis());
        }
    }

    /**
     * 按请求上下文解析调用方键和配额后检查
     *
     * @param identity      已认证调用方，匿名时为 null
     * @param clientAddress 客户端网络地址
     */
    public RateLimitDecision checkRequest(String policyName, CallerIdentity identity, String clientAddress) {
        RateLimitPolicy policy = policy(policyName);
        String callerKey = callerKey(policy, identity, clientAddress);
        int limit = policy.getMaxRequests();
        if (policy.isSubscriptionTiered()) {
            limit = identity != null && identity.hasSubscription()
                    ? settings.limitForPlan(identity.getSubscriptionPlan())
                    : settings.getDefaultMaxRequests();
            callerKey = "sub:" + callerKey;
        }
        return check(policyName, callerKey, limit);
    }

    /**
     * {@link #checkRequest} 的非阻塞版本，阻塞型存储切换到弹性线程池执行
     */
    public Mono<RateLimitDecision> checkRequestAsync(String policyName, CallerIdentity identity, String clientAddress) {
        Mono<RateLimitDecision> check = Mono.fromCallable(() -> checkRequest(policyName, identity, clientAddress));
        return store.isBlocking() ? check.subscribeOn(Schedulers.boundedElastic()) : check;
    }

    static String callerKey(RateLimitPolicy policy, CallerIdentity identity, String clientAddress) {
        if (policy.getKeyStrategy() == KeyStrategy.CALLER && identity != null && identity.getUserId() != null) {
            return "user:" + identity.getUserId();
        }
        return "ip:" + (clientAddress == null ? "unknown" : clientAddress);
    }
}

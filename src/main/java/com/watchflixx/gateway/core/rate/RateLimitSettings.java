package com.watchflixx.gateway.core.rate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 限流配置
 *
 * <p>内置策略：
 * <ul>
 *   <li><b>default</b>：默认窗口与默认配额</li>
 *   <li><b>auth</b>：15 分钟 5 次，只按客户端地址计数</li>
 *   <li><b>search</b> / <b>payment</b> / <b>upload</b> / <b>admin</b> / <b>burst</b>：1 分钟窗口</li>
 *   <li><b>subscription</b>：默认窗口，配额按订阅套餐决定</li>
 * </ul>
 * 配置文件中的 {@code policies} 可以覆盖内置策略的窗口和配额，也可以新增策略。
 */
public class RateLimitSettings {
    public static final String DEFAULT_POLICY = "default";
    public static final String SUBSCRIPTION_POLICY = "subscription";

    /** memory 或 redis */
    private String store;
    private Duration defaultWindow;
    private int defaultMaxRequests;
    /** 未知套餐的配额 */
    private int unknownPlanMaxRequests;
    /** 套餐名（大写）到配额 */
    private Map<String, Integer> subscriptionLimits;
    private Map<String, PolicyOverride> policies;

    public static RateLimitSettings defaultSettings() {
        RateLimitSettings settings = new RateLimitSettings();
        settings.setStore("memory");
        settings.setDefaultWindow(Duration.ofMinutes(15));
        settings.setDefaultMaxRequests(1000);
        settings.setUnknownPlanMaxRequests(100);
        Map<String, Integer> tiers = new LinkedHashMap<>();
        tiers.put("BASIC", 500);
        tiers.put("STANDARD", 1000);
        tiers.put("PREMIUM", 2000);
        settings.setSubscriptionLimits(tiers);
        settings.setPolicies(new LinkedHashMap<>());
        return settings;
    }

    /**
     * 合并内置策略与配置覆盖，得到每个策略的最终生效值
     */
    public Map<String, RateLimitPolicy> resolvePolicies() {
        Map<String, RateLimitPolicy> resolved = new LinkedHashMap<>();
        put(resolved, RateLimitPolicy.builder().name(DEFAULT_POLICY)
                .window(defaultWindow).maxRequests(defaultMaxRequests).build());
        put(resolved, RateLimitPolicy.builder().name("auth")
                .window(Duration.ofMinutes(15)).maxRequests(5).keyStrategy(KeyStrategy.CLIENT_ADDRESS)
                .message("Too many authentication attempts, please try again later").build());
        put(resolved, RateLimitPolicy.builder().name("search")
                .window(Duration.ofMinutes(1)).maxRequests(30)
                .message("Too many search requests, please slow down").build());
        put(resolved, RateLimitPolicy.builder().name("payment")
                .window(Duration.ofMinutes(1)).maxRequests(10)
                .message("Too many payment requests, please try again later").build());
        put(resolved, RateLimitPolicy.builder().name("upload")
                .window(Duration.ofMinutes(1)).maxRequests(5)
                .message("Too many upload requests, please try again later").build());
        put(resolved, RateLimitPolicy.builder().name("admin")
                .window(Duration.ofMinutes(1)).maxRequests(100).build());
        put(resolved, RateLimitPolicy.builder().name("burst")
                .window(Duration.ofMinutes(1)).maxRequests(100)
                .message("Request rate too high, please slow down").build());
        put(resolved, RateLimitPolicy.builder().name(SUBSCRIPTION_POLICY)
                .window(defaultWindow).maxRequests(defaultMaxRequests).subscriptionTiered(true)
                .message("Request quota for your subscription plan exceeded").build());

        policies.forEach((name, override) -> {
            RateLimitPolicy base = resolved.getOrDefault(name, RateLimitPolicy.builder()
                    .name(name).window(defaultWindow).maxRequests(defaultMaxRequests).build());
            RateLimitPolicy.RateLimitPolicyBuilder builder = base.toBuilder();
            if (override.getWindow() != null && !override.getWindow().isNegative() && !override.getWindow().isZero()) {
                builder.window(override.getWindow());
            }
            if (override.getMaxRequests() != null) {
                builder.maxRequests(Math.max(1, override.getMaxRequests()));
            }
            if (override.getKeyStrategy() != null) {
                builder.keyStrategy(override.getKeyStrategy());
            }
            if (override.getMessage() != null && !override.getMessage().isBlank()) {
                builder.message(override.getMessage());
            }
            put(resolved, builder.build());
        });
        return resolved;
    }

    private static void put(Map<String, RateLimitPolicy> target, RateLimitPolicy policy) {
        target.put(policy.getName(), policy);
    }

    /**
     * 套餐配额：无套餐使用默认配额，已知套餐按表，其余套餐使用最低配额
     */
    public int limitForPlan(String plan) {
        if (plan == null || plan.isBlank()) {
            return defaultMaxRequests;
        }
        Integer limit = subscriptionLimits.get(plan.trim().toUpperCase());
        return limit == null ? unknownPlanMaxRequests : limit;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = (store == null || store.isBlank()) ? "memory" : store.trim().toLowerCase();
    }

    public Duration getDefaultWindow() {
        return defaultWindow;
    }

    public void setDefaultWindow(Duration defaultWindow) {
        if (defaultWindow == null || defaultWindow.isNegative() || defaultWindow.isZero()) {
            this.defaultWindow = Duration.ofMinutes(15);
        } else {
            this.defaultWindow = defaultWindow;
        }
    }

    public int getDefaultMaxRequests() {
        return defaultMaxRequests;
    }

    public void setDefaultMaxRequests(int defaultMaxRequests) {
        this.defaultMaxRequests = Math.max(1, defaultMaxRequests);
    }

    public int getUnknownPlanMaxRequests() {
        return unknownPlanMaxRequests;
    }

    public void setUnknownPlanMaxRequests(int unknownPlanMaxRequests) {
        this.unknownPlanMaxRequests = Math.max(1, unknownPlanMaxRequests);
    }

    public Map<String, Integer> getSubscriptionLimits() {
        return subscriptionLimits;
    }

    public void setSubscriptionLimits(Map<String, Integer> subscriptionLimits) {
        Map<String, Integer> normalized = new LinkedHashMap<>();
        if (subscriptionLimits != null) {
            subscriptionLimits.forEach((plan, limit) -> {
                if (plan != null && limit != null) {
                    normalized.put(plan.trim().toUpperCase(), Math.max(1, limit));
                }
            });
        }
        this.subscriptionLimits = normalized;
    }

    public Map<String, PolicyOverride> getPolicies() {
        return policies;
    }

    public void setPolicies(Map<String, PolicyOverride> policies) {
        this.policies = policies == null ? new LinkedHashMap<>() : new LinkedHashMap<>(policies);
    }

    /**
     * 配置文件中单个策略的覆盖项，未设置的字段沿用内置值
     */
    public static class PolicyOverride {
        private Duration window;
        private Integer maxRequests;
        private KeyStrategy keyStrategy;
        private String message;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public Integer getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(Integer maxRequests) {
            this.maxRequests = maxRequests;
        }

        public KeyStrategy getKeyStrategy() {
            return keyStrategy;
        }

        public void setKeyStrategy(KeyStrategy keyStrategy) {
            this.keyStrategy = keyStrategy;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }
}

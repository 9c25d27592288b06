package com.watchflixx.gateway.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 静态路由定义，启动时加载，之后不可变
 *
 * <p>入站路径按最长前缀匹配到路由，再按 {@link #rewritePattern} 改写为后端路径。
 */
@Value
@Builder
public class RouteDefinition {
    String pathPrefix;
    String serviceName;
    /** 路径改写正则，null 表示不改写 */
    Pattern rewritePattern;
    @Builder.Default
    String rewriteReplacement = "";
    boolean requiresAuth;
    boolean requiresProfile;
    /** 允许访问的订阅套餐，空集合表示不限制 */
    @Singular
    Set<String> requiredPlans;
    /** 限流策略名，null 表示不限流 */
    String rateLimitPolicy;
    @Builder.Default
    boolean circuitBreakerEnabled = true;
    @Builder.Default
    boolean loadBalancerEnabled = true;
    /** 单次上游调用超时，null 时使用全局请求超时 */
    Duration timeout;
    /** 重试次数，null 时使用服务池的配置 */
    Integer retryAttempts;
    /** 追加到上游请求的固定请求头 */
    @Singular
    Map<String, String> headers;
    /** 转发前移除的请求头 */
    @Singular
    List<String> removeHeaders;

    public String rewritePath(String path) {
        if (rewritePattern == null) {
            return path;
        }
        String rewritten = rewritePattern.matcher(path).replaceFirst(rewriteReplacement);
        return rewritten.isEmpty() ? "/" : rewritten;
    }

    /**
     * 按路径段匹配前缀，"/api/v1/content" 匹配 "/api/v1/content/1" 但不匹配 "/api/v1/contents"
     */
    public boolean matches(String path) {
        if (!path.startsWith(pathPrefix)) {
            return false;
        }
        return path.length() == pathPrefix.length()
                || pathPrefix.endsWith("/")
                || path.charAt(pathPrefix.length()) == '/';
    }
}

package com.watchflixx.gateway.config;

import com.watchflixx.gateway.core.balancer.LoadBalancingSettings;
import com.watchflixx.gateway.core.balancer.LoadBalancingStrategy;
import com.watchflixx.gateway.core.breaker.CircuitBreakerSettings;
import com.watchflixx.gateway.core.client.ClientSettings;
import com.watchflixx.gateway.core.metrics.MetricsSettings;
import com.watchflixx.gateway.core.model.RouteDefinition;
import com.watchflixx.gateway.core.rate.RateLimitSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 网关配置，前缀 {@code watchflixx.gateway}
 *
 * <p>各子配置在构造时即带有完整默认值，配置文件只需覆盖需要调整的字段。
 */
@Data
@ConfigurationProperties(prefix = "watchflixx.gateway")
public class GatewayProperties {

    private String apiVersion = "v1";
    /** 代理调用的默认超时，路由可单独覆盖 */
    private Duration requestTimeout = Duration.ofSeconds(30);
    /** 诊断模式下错误响应包含异常类型与堆栈摘要，生产环境必须关闭 */
    private boolean diagnosticsEnabled = false;
    /** 管理接口的运维密钥，通过 X-API-Key 传递 */
    private List<String> adminApiKeys = new ArrayList<>();
    /** 可信反向代理的 IP，只有来自这些地址的连接才会采信 X-Forwarded-For */
    private List<String> trustedProxies = new ArrayList<>();

    private LoadBalancingSettings loadBalancing = LoadBalancingSettings.defaultSettings();
    private CircuitBreakerSettings circuitBreaker = CircuitBreakerSettings.defaultSettings();
    private RateLimitSettings rateLimit = RateLimitSettings.defaultSettings();
    private MetricsSettings metrics = MetricsSettings.defaultSettings();
    private ClientSettings client = ClientSettings.defaultSettings();

    /** 后端服务池，key 为服务名 */
    private Map<String, ServiceProperties> services = new LinkedHashMap<>();
    private List<RouteProperties> routes = new ArrayList<>();

    @Data
    public static class ServiceProperties {
        private List<EndpointProperties> endpoints = new ArrayList<>();
        /** 以下字段为空时沿用全局配置 */
        private LoadBalancingStrategy strategy;
        private Integer retryAttempts;
        private Duration retryDelay;
        private String healthPath;
        private Integer failureThreshold;
        private Duration resetTimeout;
        private List<String> expectedErrors;

        public LoadBalancingSettings toLoadBalancingSettings(LoadBalancingSettings defaults) {
            LoadBalancingSettings settings = defaults.copy();
            if (strategy != null) {
                settings.setStrategy(strategy);
            }
            if (retryAttempts != null) {
                settings.setRetryAttempts(retryAttempts);
            }
            if (retryDelay != null) {
                settings.setRetryDelay(retryDelay);
            }
            if (healthPath != null) {
                settings.setHealthPath(healthPath);
            }
            return settings;
        }

        public CircuitBreakerSettings toCircuitBreakerSettings(CircuitBreakerSettings defaults) {
            CircuitBreakerSettings settings = defaults.copy();
            if (failureThreshold != null) {
                settings.setFailureThreshold(failureThreshold);
            }
            if (resetTimeout != null) {
                settings.setResetTimeout(resetTimeout);
            }
            if (expectedErrors != null) {
                settings.setExpectedErrors(expectedErrors);
            }
            return settings;
        }

        public boolean overridesCircuitBreaker() {
            return failureThreshold != null || resetTimeout != null || expectedErrors != null;
        }
    }

    @Data
    public static class EndpointProperties {
        private String url;
        private int weight = 1;
    }

    @Data
    public static class RouteProperties {
        private String pathPrefix;
        private String service;
        /** 路径改写正则，例如 ^/api/v1/content */
        private String rewritePattern;
        private String rewriteReplacement = "";
        private boolean requiresAuth;
        private boolean requiresProfile;
        private List<String> requiredPlans = new ArrayList<>();
        private String rateLimitPolicy;
        private boolean circuitBreakerEnabled = true;
        private boolean loadBalancerEnabled = true;
        private Duration timeout;
        private Integer retryAttempts;
        private Map<String, String> headers = new LinkedHashMap<>();
        private List<String> removeHeaders = new ArrayList<>();

        public RouteDefinition toRouteDefinition() {
            RouteDefinition.RouteDefinitionBuilder builder = RouteDefinition.builder()
                    .pathPrefix(pathPrefix)
                    .serviceName(service)
                    .rewritePattern(rewritePattern == null || rewritePattern.isBlank() ? null : Pattern.compile(rewritePattern))
                    .rewriteReplacement(rewriteReplacement == null ? "" : rewriteReplacement)
                    .requiresAuth(requiresAuth)
                    .requiresProfile(requiresProfile)
                    .rateLimitPolicy(rateLimitPolicy == null || rateLimitPolicy.isBlank() ? null : rateLimitPolicy.trim())
                    .circuitBreakerEnabled(circuitBreakerEnabled)
                    .loadBalancerEnabled(loadBalancerEnabled)
                    .timeout(timeout)
                    .retryAttempts(retryAttempts)
                    .headers(headers)
                    .removeHeaders(removeHeaders);
            for (String plan : requiredPlans) {
                builder.requiredPlan(plan.trim().toUpperCase());
            }
            return builder.build();
        }
    }
}

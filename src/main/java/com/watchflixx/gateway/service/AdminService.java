package com.watchflixx.gateway.service;

import com.watchflixx.gateway.config.GatewayProperties;
import com.watchflixx.gateway.core.GatewayContext;
import com.watchflixx.gateway.core.balancer.LoadBalancer;
import com.watchflixx.gateway.core.breaker.CircuitBreaker;
import com.watchflixx.gateway.core.heartbeat.HealthProber;
import com.watchflixx.gateway.core.model.Endpoint;
import com.watchflixx.gateway.core.model.RouteDefinition;
import com.watchflixx.gateway.core.rate.RateLimitPolicy;
import com.watchflixx.gateway.core.rate.RateLimiter;
import com.watchflixx.gateway.dto.AddEndpointRequest;
import com.watchflixx.gateway.dto.CircuitBreakerStatusDto;
import com.watchflixx.gateway.dto.EndpointStatusDto;
import com.watchflixx.gateway.dto.PoolStatsDto;
import com.watchflixx.gateway.dto.ServiceMetricsDto;
import com.watchflixx.gateway.dto.UpdateWeightRequest;
import com.watchflixx.gateway.error.NotFoundException;
import com.watchflixx.gateway.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 运维操作：熔断器干预、端点增删改、指标查询与重置、配置查看
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    static final int DEFAULT_SLOW_ENDPOINT_LIMIT = 10;
    static final int MAX_SLOW_ENDPOINT_LIMIT = 100;

    private final GatewayContext context;
    private final HealthProber healthProber;
    private final RateLimiter rateLimiter;
    private final RouteTable routeTable;
    private final GatewayProperties properties;

    // ---------------------------------------------------------------- 指标

    public ServiceMetricsDto getServiceMetrics(String serviceName) {
        return context.getMetrics().getServiceMetrics(serviceName)
                .orElseThrow(() -> new NotFoundException("No metrics recorded for service " + serviceName));
    }

    public int clampSlowEndpointLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_SLOW_ENDPOINT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_SLOW_ENDPOINT_LIMIT, limit));
    }

    public void resetMetrics() {
        context.getMetrics().reset();
        log.warn("Metrics were reset by operator");
    }

    // ---------------------------------------------------------------- 熔断器

    public List<CircuitBreakerStatusDto> getCircuitBreakers() {
        return context.getCircuitBreakers().snapshots();
    }

    public CircuitBreakerStatusDto resetCircuitBreaker(String serviceName) {
        CircuitBreaker breaker = breakerFor(serviceName);
        breaker.forceClose();
        log.info("Circuit breaker for {} reset by operator", serviceName);
        return breaker.snapshot();
    }

    public CircuitBreakerStatusDto openCircuitBreaker(String serviceName) {
        CircuitBreaker breaker = breakerFor(serviceName);
        breaker.forceOpen();
        log.warn("Circuit breaker for {} opened by operator", serviceName);
        return breaker.snapshot();
    }

    // 已注册的服务即使尚未有流量也可以被干预
    private CircuitBreaker breakerFor(String serviceName) {
        context.getLoadBalancers().require(serviceName);
        return context.getCircuitBreakers().getOrCreate(serviceName);
    }

    // ---------------------------------------------------------------- 负载均衡

    public List<PoolStatsDto> getLoadBalancers() {
        return context.getLoadBalancers().all().stream()
                .map(LoadBalancer::getStats)
                .collect(Collectors.toList());
    }

    /**
     * 注册端点并立即探测一次，探测结果决定它是否马上参与选择
     */
    public Mono<EndpointStatusDto> addEndpoint(String serviceName, AddEndpointRequest request) {
        return Mono.defer(() -> {
            LoadBalancer balancer = context.getLoadBalancers().require(serviceName);
            if (request == null) {
                return Mono.error(new ValidationException("Request body is required"));
            }
            int weight = request.getWeight() == null ? 1 : request.getWeight();
            if (weight < 1) {
                return Mono.error(new ValidationException("Weight must be at least 1"));
            }
            Endpoint endpoint = balancer.addEndpoint(request.getUrl(), weight);
            return healthProber.probeEndpoint(balancer, endpoint)
                    .thenReturn(LoadBalancer.toStatus(endpoint));
        });
    }

    public void removeEndpoint(String serviceName, String url) {
        LoadBalancer balancer = context.getLoadBalancers().require(serviceName);
        if (url == null || url.isBlank()) {
            throw new ValidationException("Query parameter 'url' is required");
        }
        if (!balancer.removeEndpoint(url)) {
            throw new NotFoundException("Endpoint " + url + " is not registered for " + serviceName);
        }
    }

    public EndpointStatusDto updateWeight(String serviceName, UpdateWeightRequest request) {
        LoadBalancer balancer = context.getLoadBalancers().require(serviceName);
        if (request == null || request.getUrl() == null || request.getWeight() == null) {
            throw new ValidationException("Both 'url' and 'weight' are required");
        }
        if (request.getWeight() < 1) {
            throw new ValidationException("Weight must be at least 1");
        }
        if (!balancer.updateWeight(request.getUrl(), request.getWeight())) {
            throw new NotFoundException("Endpoint " + request.getUrl() + " is not registered for " + serviceName);
        }
        return balancer.findEndpoint(request.getUrl())
                .map(LoadBalancer::toStatus)
                .orElseThrow(() -> new NotFoundException("Endpoint " + request.getUrl() + " was removed concurrently"));
    }

    // ---------------------------------------------------------------- 配置

    /**
     * 当前生效配置，不包含运维密钥
     */
    public Map<String, Object> getConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("apiVersion", properties.getApiVersion());
        config.put("requestTimeout", properties.getRequestTimeout().toString());
        config.put("diagnosticsEnabled", properties.isDiagnosticsEnabled());
        config.put("adminApiKeys", properties.getAdminApiKeys().size() + " configured");
        config.put("loadBalancing", properties.getLoadBalancing());
        config.put("circuitBreaker", properties.getCircuitBreaker());
        config.put("metrics", properties.getMetrics());
        config.put("rateLimitStore", properties.getRateLimit().getStore());

        Map<String, Object> policies = new LinkedHashMap<>();
        for (RateLimitPolicy policy : rateLimiter.getPolicies().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("window", policy.getWindow().toString());
            entry.put("maxRequests", policy.getMaxRequests());
            entry.put("keyStrategy", policy.getKeyStrategy().name());
            entry.put("subscriptionTiered", policy.isSubscriptionTiered());
            policies.put(policy.getName(), entry);
        }
        config.put("rateLimitPolicies", policies);

        Map<String, Object> services = new LinkedHashMap<>();
        for (LoadBalancer balancer : context.getLoadBalancers().all()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("strategy", balancer.getSettings().getStrategy().label());
            entry.put("retryAttempts", balancer.getSettings().getRetryAttempts());
            entry.put("endpoints", balancer.getEndpoints().stream().map(Endpoint::getUrl).collect(Collectors.toList()));
            services.put(balancer.getServiceName(), entry);
        }
        config.put("services", services);

        List<Map<String, Object>> routes = new ArrayList<>();
        for (RouteDefinition route : routeTable.getRoutes()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("pathPrefix", route.getPathPrefix());
            entry.put("service", route.getServiceName());
            entry.put("requiresAuth", route.isRequiresAuth());
            entry.put("requiresProfile", route.isRequiresProfile());
            entry.put("requiredPlans", route.getRequiredPlans());
            entry.put("rateLimitPolicy", route.getRateLimitPolicy());
            entry.put("circuitBreakerEnabled", route.isCircuitBreakerEnabled());
            entry.put("loadBalancerEnabled", route.isLoadBalancerEnabled());
            routes.add(entry);
        }
        config.put("routes", routes);
        return config;
    }
}

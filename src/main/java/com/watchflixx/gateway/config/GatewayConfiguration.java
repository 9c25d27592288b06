package com.watchflixx.gateway.config;

import com.watchflixx.gateway.core.GatewayContext;
import com.watchflixx.gateway.core.balancer.LoadBalancer;
import com.watchflixx.gateway.core.balancer.LoadBalancerRegistry;
import com.watchflixx.gateway.core.breaker.CircuitBreakerRegistry;
import com.watchflixx.gateway.core.breaker.CircuitBreakerSettings;
import com.watchflixx.gateway.core.breaker.CircuitStateListener;
import com.watchflixx.gateway.core.breaker.LoggingCircuitStateListener;
import com.watchflixx.gateway.core.client.EndpointWebClientManager;
import com.watchflixx.gateway.core.client.UpstreamClient;
import com.watchflixx.gateway.core.client.WebClientUpstreamClient;
import com.watchflixx.gateway.core.heartbeat.HealthProbe;
import com.watchflixx.gateway.core.heartbeat.HealthProber;
import com.watchflixx.gateway.core.heartbeat.WebClientHealthProbe;
import com.watchflixx.gateway.core.metrics.GatewayMeterBinder;
import com.watchflixx.gateway.core.metrics.MetricsAggregator;
import com.watchflixx.gateway.core.model.RouteDefinition;
import com.watchflixx.gateway.core.rate.InMemoryRateLimitStore;
import com.watchflixx.gateway.core.rate.RateLimitStore;
import com.watchflixx.gateway.core.rate.RateLimiter;
import com.watchflixx.gateway.core.rate.RedisRateLimitStore;
import com.watchflixx.gateway.service.CallerIdentityResolver;
import com.watchflixx.gateway.service.HeaderCallerIdentityResolver;
import com.watchflixx.gateway.service.InflightRequestTracker;
import com.watchflixx.gateway.service.ProxyErrorClassifier;
import com.watchflixx.gateway.service.ProxyService;
import com.watchflixx.gateway.service.RouteTable;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 网关组件装配
 *
 * <p>核心组件本身不依赖 Spring，全部在这里按 {@link GatewayProperties} 构建。
 * 启动时校验路由引用的服务和限流策略，配置错误直接阻止启动。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "destroy")
    public EndpointWebClientManager endpointWebClientManager(GatewayProperties properties) {
        return new EndpointWebClientManager(properties.getClient());
    }

    @Bean
    @ConditionalOnMissingBean
    public UpstreamClient upstreamClient(EndpointWebClientManager webClientManager) {
        return new WebClientUpstreamClient(webClientManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthProbe healthProbe(EndpointWebClientManager webClientManager) {
        return new WebClientHealthProbe(webClientManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitStateListener circuitStateListener() {
        return new LoggingCircuitStateListener();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public MetricsAggregator metricsAggregator(GatewayProperties properties, Clock clock) {
        return new MetricsAggregator(properties.getMetrics(), clock);
    }

    @Bean
    public GatewayContext gatewayContext(GatewayProperties properties,
                                         UpstreamClient upstreamClient,
                                         CircuitStateListener listener,
                                         MetricsAggregator metrics,
                                         Clock clock) {
        LoadBalancerRegistry loadBalancers = new LoadBalancerRegistry(upstreamClient, clock);
        Map<String, CircuitBreakerSettings> breakerOverrides = new LinkedHashMap<>();

        properties.getServices().forEach((name, service) -> {
            LoadBalancer balancer = loadBalancers.register(name, service.toLoadBalancingSettings(properties.getLoadBalancing()));
            for (GatewayProperties.EndpointProperties endpoint : service.getEndpoints()) {
                balancer.addEndpoint(endpoint.getUrl(), endpoint.getWeight());
            }
            if (service.overridesCircuitBreaker()) {
                breakerOverrides.put(name, service.toCircuitBreakerSettings(properties.getCircuitBreaker()));
            }
            log.info("Service {} configured with {} endpoint(s), strategy {}",
                    name, balancer.getEndpoints().size(), balancer.getSettings().getStrategy().label());
        });

        CircuitBreakerRegistry circuitBreakers =
                new CircuitBreakerRegistry(properties.getCircuitBreaker(), breakerOverrides, clock, listener);
        return new GatewayContext(loadBalancers, circuitBreakers, metrics, clock);
    }

    @Bean
    public GatewayMeterBinder gatewayMeterBinder(GatewayContext context) {
        return new GatewayMeterBinder(context.getMetrics(), context.getCircuitBreakers(),
                context.getLoadBalancers().serviceNames());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public PrometheusMeterRegistry prometheusMeterRegistry(GatewayMeterBinder gatewayMeterBinder) {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        gatewayMeterBinder.bindTo(registry);
        return registry;
    }

    @Bean
    public HealthProber healthProber(GatewayContext context, HealthProbe healthProbe, GatewayProperties properties) {
        return new HealthProber(context.getLoadBalancers(), healthProbe,
                properties.getLoadBalancing().getHealthCheckInterval(), context.getClock());
    }

    @Bean
    public RateLimitStore rateLimitStore(GatewayProperties properties,
                                         ObjectProvider<StringRedisTemplate> redisTemplate,
                                         Clock clock) {
        String store = properties.getRateLimit().getStore();
        if ("redis".equalsIgnoreCase(store)) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("Rate limit store 'redis' requires a configured Redis connection");
            }
            log.info("Rate limiting backed by Redis");
            return new RedisRateLimitStore(template, clock);
        }
        if (!"memory".equalsIgnoreCase(store)) {
            throw new IllegalStateException("Unknown rate limit store: " + store);
        }
        return new InMemoryRateLimitStore(clock);
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitStore store, GatewayProperties properties, Clock clock) {
        return new RateLimiter(store, properties.getRateLimit(), clock);
    }

    @Bean
    public RouteTable routeTable(GatewayProperties properties, GatewayContext context, RateLimiter rateLimiter) {
        List<RouteDefinition> routes = new ArrayList<>();
        for (GatewayProperties.RouteProperties route : properties.getRoutes()) {
            RouteDefinition definition = route.toRouteDefinition();
            if (definition.getPathPrefix() == null || !definition.getPathPrefix().startsWith("/")) {
                throw new IllegalStateException("Route path prefix must start with '/': " + definition.getPathPrefix());
            }
            if (context.getLoadBalancers().find(definition.getServiceName()).isEmpty()) {
                throw new IllegalStateException("Route " + definition.getPathPrefix()
                        + " references unknown service " + definition.getServiceName());
            }
            if (definition.getRateLimitPolicy() != null && !rateLimiter.hasPolicy(definition.getRateLimitPolicy())) {
                throw new IllegalStateException("Route " + definition.getPathPrefix()
                        + " references unknown rate limit policy " + definition.getRateLimitPolicy());
            }
            routes.add(definition);
        }
        log.info("Loaded {} route(s)", routes.size());
        return new RouteTable(routes);
    }

    @Bean
    @ConditionalOnMissingBean
    public CallerIdentityResolver callerIdentityResolver() {
        return new HeaderCallerIdentityResolver();
    }

    @Bean
    public InflightRequestTracker inflightRequestTracker() {
        return new InflightRequestTracker();
    }

    @Bean
    public ProxyErrorClassifier proxyErrorClassifier() {
        return new ProxyErrorClassifier();
    }

    @Bean
    public ProxyService proxyService(GatewayContext context,
                                     RouteTable routeTable,
                                     RateLimiter rateLimiter,
                                     ProxyErrorClassifier errorClassifier,
                                     InflightRequestTracker inflightTracker,
                                     GatewayProperties properties) {
        return new ProxyService(context, routeTable, rateLimiter, errorClassifier, inflightTracker,
                properties.getRequestTimeout());
    }
}

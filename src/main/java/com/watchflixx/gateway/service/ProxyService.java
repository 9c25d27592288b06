package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.GatewayContext;
import com.watchflixx.gateway.core.balancer.LoadBalancer;
import com.watchflixx.gateway.core.client.UpstreamRequest;
import com.watchflixx.gateway.core.client.UpstreamResponse;
import com.watchflixx.gateway.core.metrics.PathNormalizer;
import com.watchflixx.gateway.core.model.CallerIdentity;
import com.watchflixx.gateway.core.model.RequestMetric;
import com.watchflixx.gateway.core.model.RouteDefinition;
import com.watchflixx.gateway.core.rate.RateLimitDecision;
import com.watchflixx.gateway.core.rate.RateLimiter;
import com.watchflixx.gateway.error.AuthenticationException;
import com.watchflixx.gateway.error.AuthorizationException;
import com.watchflixx.gateway.error.GatewayException;
import com.watchflixx.gateway.error.NotFoundException;
import com.watchflixx.gateway.error.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 代理主流程：路由 → 访问检查 → 限流 → 熔断器 → 负载均衡 → 上游
 *
 * <p>每个请求无论成功失败都会记录一条 {@link RequestMetric}。
 * 失败统一交给 {@link ProxyErrorClassifier}，对外只暴露 {@link GatewayException}。
 */
@Slf4j
public class ProxyService {

    private final GatewayContext context;
    private final RouteTable routeTable;
    private final RateLimiter rateLimiter;
    private final ProxyErrorClassifier errorClassifier;
    private final InflightRequestTracker inflightTracker;
    private final Duration defaultTimeout;

    public ProxyService(GatewayContext context,
                        RouteTable routeTable,
                        RateLimiter rateLimiter,
                        ProxyErrorClassifier errorClassifier,
                        InflightRequestTracker inflightTracker,
                        Duration defaultTimeout) {
        this.context = context;
        this.routeTable = routeTable;
        this.rateLimiter = rateLimiter;
        this.errorClassifier = errorClassifier;
        this.inflightTracker = inflightTracker;
        this.defaultTimeout = defaultTimeout;
    }

    public Mono<ProxyResult> handle(InboundRequest inbound) {
        return Mono.defer(() -> {
            long startedAt = context.getClock().millis();
            inflightTracker.onStart();
            RouteDefinition route = routeTable.resolve(inbound.getPath()).orElse(null);
            String serviceName = route == null ? null : route.getServiceName();

            Mono<ProxyResult> pipeline = route == null
                    ? Mono.error(new NotFoundException("No route for path " + inbound.getPath()))
                    : Mono.defer(() -> proxy(route, inbound));

            return pipeline
                    .onErrorMap(error -> errorClassifier.classify(error, serviceName))
                    .doOnSuccess(result -> {
                        if (result != null) {
                            record(inbound, serviceName, result.getResponse().getStatusCode(), startedAt);
                        }
                    })
                    .doOnError(GatewayException.class, error -> {
                        record(inbound, serviceName, error.getStatusCode(), startedAt);
                        logFailure(inbound, serviceName, error);
                    })
                    .doFinally(signal -> inflightTracker.onEnd());
        });
    }

    private Mono<ProxyResult> proxy(RouteDefinition route, InboundRequest inbound) {
        checkAccess(route, inbound.getIdentity());
        return checkRateLimit(route, inbound)
                .flatMap(decision -> forward(route, inbound)
                        .map(response -> new ProxyResult(route, response, decision.orElse(null))));
    }

    private void checkAccess(RouteDefinition route, CallerIdentity identity) {
        boolean needsIdentity = route.isRequiresAuth() || route.isRequiresProfile() || !route.getRequiredPlans().isEmpty();
        if (needsIdentity && identity == null) {
            throw new AuthenticationException("Authentication required");
        }
        if (route.isRequiresProfile() && !identity.hasProfile()) {
            throw new AuthorizationException("Profile selection required");
        }
        if (!route.getRequiredPlans().isEmpty()) {
            if (!identity.hasActiveSubscription()) {
                throw new AuthorizationException("Active subscription required");
            }
            if (!route.getRequiredPlans().contains(identity.getSubscriptionPlan().toUpperCase())) {
                throw new AuthorizationException("Subscription plan does not include this feature")
                        .withDetail("requiredPlans", route.getRequiredPlans());
            }
        }
    }

    private Mono<Optional<RateLimitDecision>> checkRateLimit(RouteDefinition route, InboundRequest inbound) {
        String policyName = route.getRateLimitPolicy();
        if (policyName == null) {
            return Mono.just(Optional.empty());
        }
        return rateLimiter.checkRequestAsync(policyName, inbound.getIdentity(), inbound.getClientAddress())
                .map(decision -> {
                    if (!decision.isAllowed()) {
                        throw new RateLimitExceededException(policyName, rateLimiter.policy(policyName).getMessage(), decision);
                    }
                    return Optional.of(decision);
                });
    }

    private Mono<UpstreamResponse> forward(RouteDefinition route, InboundRequest inbound) {
        LoadBalancer balancer = context.getLoadBalancers().require(route.getServiceName());
        UpstreamRequest request = UpstreamRequest.builder()
                .method(inbound.getMethod())
                .path(inbound.pathWithQuery(route.rewritePath(inbound.getPath())))
                .headers(ProxyHeaders.outbound(route, inbound))
                .body(inbound.getBody())
                .timeout(route.getTimeout() == null ? defaultTimeout : route.getTimeout())
                .requestId(inbound.getRequestId())
                .build();

        Supplier<Mono<UpstreamResponse>> call;
        if (route.isLoadBalancerEnabled()) {
            int retries = route.getRetryAttempts() == null
                    ? balancer.getSettings().getRetryAttempts()
                    : route.getRetryAttempts();
            call = () -> balancer.execute(request, retries);
        } else {
            call = () -> balancer.executeDirect(request);
        }

        if (log.isDebugEnabled()) {
            log.debug("Proxying {} {} -> {}{} [{}]", inbound.getMethod(), inbound.getPath(),
                    route.getServiceName(), request.getPath(), inbound.getRequestId());
        }
        if (!route.isCircuitBreakerEnabled()) {
            return call.get();
        }
        return context.getCircuitBreakers().getOrCreate(route.getServiceName()).execute(call);
    }

    private void record(InboundRequest inbound, String serviceName, int statusCode, long startedAt) {
        CallerIdentity identity = inbound.getIdentity();
        context.getMetrics().record(RequestMetric.builder()
                .timestamp(startedAt)
                .method(inbound.getMethod() == null ? "UNKNOWN" : inbound.getMethod().name())
                .path(PathNormalizer.normalize(inbound.getPath()))
                .statusCode(statusCode)
                .responseTimeMs(Math.max(0, context.getClock().millis() - startedAt))
                .serviceName(serviceName)
                .userId(identity == null ? null : identity.getUserId())
                .build());
    }

    private void logFailure(InboundRequest inbound, String serviceName, GatewayException error) {
        if (error.getStatusCode() >= 500) {
            log.error("Proxy {} {} to {} failed [{}]: {}", inbound.getMethod(), inbound.getPath(),
                    serviceName, inbound.getRequestId(), error.getMessage());
        } else {
            log.info("Proxy {} {} rejected with {} [{}]: {}", inbound.getMethod(), inbound.getPath(),
                    error.getStatusCode(), inbound.getRequestId(), error.getMessage());
        }
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }
}

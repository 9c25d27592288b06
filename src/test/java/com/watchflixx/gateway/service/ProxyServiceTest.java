package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.GatewayContext;
import com.watchflixx.gateway.core.balancer.LoadBalancer;
import com.watchflixx.gateway.core.balancer.LoadBalancerRegistry;
import com.watchflixx.gateway.core.balancer.LoadBalancingSettings;
import com.watchflixx.gateway.core.balancer.NoHealthyEndpointException;
import com.watchflixx.gateway.core.breaker.CircuitBreakerOpenException;
import com.watchflixx.gateway.core.breaker.CircuitBreakerRegistry;
import com.watchflixx.gateway.core.breaker.CircuitBreakerSettings;
import com.watchflixx.gateway.core.breaker.CircuitState;
import com.watchflixx.gateway.core.breaker.CircuitStateListener;
import com.watchflixx.gateway.core.client.UpstreamRequest;
import com.watchflixx.gateway.core.metrics.MetricsAggregator;
import com.watchflixx.gateway.core.metrics.MetricsSettings;
import com.watchflixx.gateway.core.model.CallerIdentity;
import com.watchflixx.gateway.core.model.RequestMetric;
import com.watchflixx.gateway.core.model.RouteDefinition;
import com.watchflixx.gateway.core.rate.InMemoryRateLimitStore;
import com.watchflixx.gateway.core.rate.RateLimitSettings;
import com.watchflixx.gateway.core.rate.RateLimiter;
import com.watchflixx.gateway.error.AuthenticationException;
import com.watchflixx.gateway.error.AuthorizationException;
import com.watchflixx.gateway.error.BadGatewayException;
import com.watchflixx.gateway.error.GatewayException;
import com.watchflixx.gateway.error.NotFoundException;
import com.watchflixx.gateway.error.RateLimitExceededException;
import com.watchflixx.gateway.support.FakeUpstreamClient;
import com.watchflixx.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProxyServiceTest {

    private static final String CONTENT = "http://content:3002";
    private static final String STREAMING = "http://streaming:3003";
    private static final String PAYMENT = "http://payment:3004";
    private static final String ANALYTICS = "http://analytics:3006";

    private MutableClock clock;
    private FakeUpstreamClient upstream;
    private GatewayContext context;
    private InflightRequestTracker tracker;
    private ProxyService proxyService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T12:00:00Z");
        upstream = new FakeUpstreamClient();

        LoadBalancerRegistry balancers = new LoadBalancerRegistry(upstream, clock);
        LoadBalancingSettings lbSettings = LoadBalancingSettings.defaultSettings();
        lbSettings.setRetryDelay(Duration.ZERO);
        register(balancers, "content", lbSettings, CONTENT);
        register(balancers, "streaming", lbSettings, STREAMING);
        register(balancers, "payment", lbSettings, PAYMENT);
        register(balancers, "analytics", lbSettings, ANALYTICS);

        CircuitBreakerSettings breakerSettings = CircuitBreakerSettings.defaultSettings();
        breakerSettings.setFailureThreshold(2);
        breakerSettings.setCallTimeout(Duration.ZERO);
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(breakerSettings, Map.of(), clock, CircuitStateListener.NO_OP);

        MetricsAggregator metrics = new MetricsAggregator(MetricsSettings.defaultSettings(), clock);
        context = new GatewayContext(balancers, breakers, metrics, clock);

        RateLimitSettings rateSettings = RateLimitSettings.defaultSettings();
        RateLimitSettings.PolicyOverride tight = new RateLimitSettings.PolicyOverride();
        tight.setWindow(Duration.ofMinutes(1));
        tight.setMaxRequests(2);
        rateSettings.getPolicies().put("tight", tight);
        RateLimiter rateLimiter = new RateLimiter(new InMemoryRateLimitStore(clock), rateSettings, clock);

        RouteTable routes = new RouteTable(List.of(
                RouteDefinition.builder()
                        .pathPrefix("/api/v1/content")
                        .serviceName("content")
                        .rewritePattern(Pattern.compile("^/api/v1/content"))
                        .rewriteReplacement("/v1/content")
                        .rateLimitPolicy("tight")
                        .build(),
                RouteDefinition.builder()
                        .pathPrefix("/api/v1/streaming")
                        .serviceName("streaming")
                        .requiresAuth(true)
                        .requiresProfile(true)
                        .requiredPlan("STANDARD")
                        .requiredPlan("PREMIUM")
                        .build(),
                RouteDefinition.builder()
                        .pathPrefix("/api/v1/payments")
                        .serviceName("payment")
                        .requiresAuth(true)
                        .retryAttempts(0)
                        .build(),
                RouteDefinition.builder()
                        .pathPrefix("/api/v1/analytics")
                        .serviceName("analytics")
                        .circuitBreakerEnabled(false)
                        .build()));

        tracker = new InflightRequestTracker();
        proxyService = new ProxyService(context, routes, rateLimiter, new ProxyErrorClassifier(), tracker,
                Duration.ofSeconds(30));
    }

    private void register(LoadBalancerRegistry registry, String service, LoadBalancingSettings settings, String url) {
        LoadBalancer balancer = registry.register(service, settings.copy());
        balancer.addEndpoint(url, 1).markHealthy(3, Instant.now(clock));
    }

    private static InboundRequest request(String path, CallerIdentity identity) {
        return InboundRequest.builder()
                .method(HttpMethod.GET)
                .path(path)
                .clientAddress("10.0.0.5")
                .requestId("req-1")
                .identity(identity)
                .build();
    }

    private static CallerIdentity subscriber(String plan, String profile) {
        return CallerIdentity.builder()
                .userId("u-1")
                .profileId(profile)
                .subscriptionPlan(plan)
                .subscriptionStatus(CallerIdentity.STATUS_ACTIVE)
                .build();
    }

    private RequestMetric lastMetric() {
        List<RequestMetric> recorded = context.getMetrics().snapshot();
        return recorded.get(recorded.size() - 1);
    }

    @Test
    void forwardsRewrittenPathWithQueryAndIdentity() {
        InboundRequest inbound = InboundRequest.builder()
                .method(HttpMethod.GET)
                .path("/api/v1/content/42")
                .query("lang=en")
                .clientAddress("10.0.0.5")
                .requestId("req-9")
                .identity(subscriber("PREMIUM", "p-1"))
                .build();

        StepVerifier.create(proxyService.handle(inbound))
                .assertNext(result -> {
                    assertEquals(200, result.getResponse().getStatusCode());
                    assertEquals("content", result.getRoute().getServiceName());
                    assertEquals(2, result.getRateLimit().getLimit());
                    assertEquals(1, result.getRateLimit().getRemaining());
                })
                .verifyComplete();

        UpstreamRequest sent = upstream.requests().get(0);
        assertEquals("/v1/content/42?lang=en", sent.getPath());
        assertEquals(Duration.ofSeconds(30), sent.getTimeout());
        HttpHeaders headers = sent.getHeaders();
        assertEquals("u-1", headers.getFirst(ProxyHeaders.USER_ID));
        assertEquals("req-9", headers.getFirst(ProxyHeaders.REQUEST_ID));
        assertEquals("content", headers.getFirst(ProxyHeaders.GATEWAY_SERVICE));

        RequestMetric metric = lastMetric();
        assertEquals("/api/v1/content/:id", metric.getPath());
        assertEquals("content", metric.getServiceName());
        assertEquals("u-1", metric.getUserId());
        assertEquals(200, metric.getStatusCode());
        assertEquals(0, tracker.inflight());
    }

    @Test
    void unknownPathIsNotFoundAndRecordedWithoutService() {
        StepVerifier.create(proxyService.handle(request("/api/v2/unknown", null)))
                .expectError(NotFoundException.class)
                .verify();

        RequestMetric metric = lastMetric();
        assertEquals(404, metric.getStatusCode());
        assertNull(metric.getServiceName());
        assertTrue(upstream.calls().isEmpty());
        assertEquals(0, tracker.inflight());
    }

    @Test
    void protectedRouteRequiresIdentity() {
        StepVerifier.create(proxyService.handle(request("/api/v1/streaming/manifest", null)))
                .expectError(AuthenticationException.class)
                .verify();

        assertEquals(401, lastMetric().getStatusCode());
        assertTrue(upstream.calls().isEmpty());
    }

    @Test
    void streamingRequiresProfileAndEligiblePlan() {
        StepVerifier.create(proxyService.handle(request("/api/v1/streaming/manifest", subscriber("PREMIUM", null))))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(AuthorizationException.class, error);
                    assertEquals("Profile selection required", error.getMessage());
                })
                .verify();

        StepVerifier.create(proxyService.handle(request("/api/v1/streaming/manifest", subscriber("BASIC", "p-1"))))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(AuthorizationException.class, error);
                    assertEquals(403, ((GatewayException) error).getStatusCode());
                })
                .verify();

        CallerIdentity lapsed = CallerIdentity.builder().userId("u-2").profileId("p-1")
                .subscriptionPlan("PREMIUM").subscriptionStatus("PAST_DUE").build();
        StepVerifier.create(proxyService.handle(request("/api/v1/streaming/manifest", lapsed)))
                .expectErrorMessage("Active subscription required")
                .verify();

        StepVerifier.create(proxyService.handle(request("/api/v1/streaming/manifest", subscriber("PREMIUM", "p-1"))))
                .assertNext(result -> assertEquals(200, result.getResponse().getStatusCode()))
                .verifyComplete();
        assertEquals(List.of(STREAMING), upstream.calls());
    }

    @Test
    void rateLimitRejectsBeforeReachingUpstream() {
        for (int i = 0; i < 2; i++) {
            StepVerifier.create(proxyService.handle(request("/api/v1/content", null)))
                    .expectNextCount(1)
                    .verifyComplete();
        }

        StepVerifier.create(proxyService.handle(request("/api/v1/content", null)))
                .expectErrorSatisfies(error -> {
                    RateLimitExceededException limited = assertInstanceOf(RateLimitExceededException.class, error);
                    assertEquals(429, limited.getStatusCode());
                    assertEquals(0, limited.getDecision().getRemaining());
                    assertEquals(clock.millis() + 60_000, limited.getDecision().getResetTime());
                })
                .verify();

        assertEquals(2, upstream.calls().size());
        assertEquals(429, lastMetric().getStatusCode());
    }

    @Test
    void upstreamServerErrorBecomesBadGateway() {
        upstream.respond(PAYMENT, 500, "boom");

        StepVerifier.create(proxyService.handle(request("/api/v1/payments/charge", subscriber("BASIC", null))))
                .expectError(BadGatewayException.class)
                .verify();

        assertEquals(1, upstream.calls().size());
        assertEquals(502, lastMetric().getStatusCode());
        assertFalse(context.getLoadBalancers().require("payment").findEndpoint(PAYMENT).orElseThrow().isHealthy());
    }

    @Test
    void clientErrorsFromUpstreamArePassedThrough() {
        upstream.respond(PAYMENT, 402, "payment required");

        StepVerifier.create(proxyService.handle(request("/api/v1/payments/charge", subscriber("BASIC", null))))
                .assertNext(result -> assertEquals(402, result.getResponse().getStatusCode()))
                .verifyComplete();

        assertEquals(402, lastMetric().getStatusCode());
        assertEquals(CircuitState.CLOSED, context.getCircuitBreakers().require("payment").getState());
    }

    @Test
    void repeatedFailuresOpenTheBreakerAndShortCircuit() {
        upstream.respond(PAYMENT, 503);
        LoadBalancer payment = context.getLoadBalancers().require("payment");
        CallerIdentity caller = subscriber("BASIC", null);

        for (int i = 0; i < 2; i++) {
            payment.findEndpoint(PAYMENT).orElseThrow().markHealthy(3, Instant.now(clock));
            StepVerifier.create(proxyService.handle(request("/api/v1/payments/charge", caller)))
                    .expectError(BadGatewayException.class)
                    .verify();
        }
        assertEquals(CircuitState.OPEN, context.getCircuitBreakers().require("payment").getState());

        payment.findEndpoint(PAYMENT).orElseThrow().markHealthy(3, Instant.now(clock));
        StepVerifier.create(proxyService.handle(request("/api/v1/payments/charge", caller)))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(CircuitBreakerOpenException.class, error);
                    assertEquals("payment service is temporarily unavailable", error.getMessage());
                    assertEquals(503, ((GatewayException) error).getStatusCode());
                })
                .verify();
        assertEquals(2, upstream.calls().size());
    }

    @Test
    void routeWithBreakerDisabledNeverCreatesOne() {
        upstream.respond(ANALYTICS, 500);
        LoadBalancer analytics = context.getLoadBalancers().require("analytics");

        for (int i = 0; i < 3; i++) {
            analytics.findEndpoint(ANALYTICS).orElseThrow().markHealthy(3, Instant.now(clock));
            // 唯一端点失败后立即下线，重试前发现无健康端点，直接返回 503
            StepVerifier.create(proxyService.handle(request("/api/v1/analytics/events", null)))
                    .expectError(NoHealthyEndpointException.class)
                    .verify();
        }

        assertTrue(context.getCircuitBreakers().find("analytics").isEmpty());
        assertEquals(3, upstream.calls().size());
    }
}

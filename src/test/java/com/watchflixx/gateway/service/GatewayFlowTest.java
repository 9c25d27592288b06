package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.GatewayContext;
import com.watchflixx.gateway.core.balancer.LoadBalancer;
import com.watchflixx.gateway.core.balancer.LoadBalancerRegistry;
import com.watchflixx.gateway.core.balancer.LoadBalancingSettings;
import com.watchflixx.gateway.core.breaker.CircuitBreakerRegistry;
import com.watchflixx.gateway.core.breaker.CircuitBreakerSettings;
import com.watchflixx.gateway.core.breaker.CircuitState;
import com.watchflixx.gateway.core.breaker.CircuitStateListener;
import com.watchflixx.gateway.core.heartbeat.HealthProber;
import com.watchflixx.gateway.core.metrics.MetricsAggregator;
import com.watchflixx.gateway.core.metrics.MetricsSettings;
import com.watchflixx.gateway.core.model.HealthStatus;
import com.watchflixx.gateway.core.model.RouteDefinition;
import com.watchflixx.gateway.core.rate.InMemoryRateLimitStore;
import com.watchflixx.gateway.core.rate.RateLimitSettings;
import com.watchflixx.gateway.core.rate.RateLimiter;
import com.watchflixx.gateway.support.FakeHealthProbe;
import com.watchflixx.gateway.support.FakeUpstreamClient;
import com.watchflixx.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

/**
 * 路由、熔断、负载均衡、健康探测和监控视图串起来的完整链路
 */
class GatewayFlowTest {

    private static final String A = "http://content-a:3002";
    private static final String B = "http://content-b:3002";
    private static final String C = "http://content-c:3002";

    private MutableClock clock;
    private FakeUpstreamClient upstream;
    private FakeHealthProbe probe;
    private GatewayContext context;
    private HealthProber prober;
    private ProxyService proxyService;
    private MonitoringService monitoring;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T12:00:00Z");
        upstream = new FakeUpstreamClient();
        probe = new FakeHealthProbe();

        LoadBalancerRegistry balancers = new LoadBalancerRegistry(upstream, clock);
        LoadBalancingSettings settings = LoadBalancingSettings.defaultSettings();
        settings.setRetryDelay(Duration.ZERO);
        LoadBalancer content = balancers.register("content", settings);
        for (String url : List.of(A, B, C)) {
            content.addEndpoint(url, 1);
        }

        CircuitBreakerSettings breakerSettings = CircuitBreakerSettings.defaultSettings();
        breakerSettings.setCallTimeout(Duration.ZERO);
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(breakerSettings, Map.of(), clock, CircuitStateListener.NO_OP);
        context = new GatewayContext(balancers, breakers, new MetricsAggregator(MetricsSettings.defaultSettings(), clock), clock);

        RouteTable routes = new RouteTable(List.of(RouteDefinition.builder()
                .pathPrefix("/api/v1/content")
                .serviceName("content")
                .timeout(Duration.ofMillis(200))
                .build()));
        RateLimiter rateLimiter = new RateLimiter(new InMemoryRateLimitStore(clock), RateLimitSettings.defaultSettings(), clock);
        InflightRequestTracker tracker = new InflightRequestTracker();
        proxyService = new ProxyService(context, routes, rateLimiter, new ProxyErrorClassifier(), tracker, Duration.ofSeconds(30));
        prober = new HealthProber(balancers, probe, Duration.ofSeconds(30), clock);
        monitoring = new MonitoringService(context, tracker);
    }

    private static InboundRequest get(String path) {
        return InboundRequest.builder()
                .method(HttpMethod.GET)
                .path(path)
                .clientAddress("10.0.0.5")
                .requestId("req-flow")
                .build();
    }

    @Test
    void hangingEndpointIsTakenOutOfRotationUntilItRecovers() {
        upstream.hang(B);
        prober.probeAll().block();
        assertEquals(MonitoringService.HEALTHY, monitoring.serviceHealth("content").getStatus());

        StepVerifier.create(proxyService.handle(get("/api/v1/content/1")))
                .assertNext(result -> assertEquals(A, result.getResponse().getEndpointUrl()))
                .verifyComplete();

        // 第二次轮到 B，超时后 B 下线，重试落到其余端点
        StepVerifier.create(proxyService.handle(get("/api/v1/content/2")))
                .assertNext(result -> assertNotEquals(B, result.getResponse().getEndpointUrl()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        LoadBalancer content = context.getLoadBalancers().require("content");
        assertEquals(HealthStatus.UNHEALTHY, content.findEndpoint(B).orElseThrow().getHealth().getStatus());
        assertEquals(MonitoringService.DEGRADED, monitoring.serviceHealth("content").getStatus());
        assertEquals(MonitoringService.HEALTHY, monitoring.overallHealth().get("status"));
        assertEquals(CircuitState.CLOSED, context.getCircuitBreakers().require("content").getState());

        // 后续请求不再落到 B
        for (int i = 0; i < 4; i++) {
            StepVerifier.create(proxyService.handle(get("/api/v1/content/list")))
                    .assertNext(result -> assertNotEquals(B, result.getResponse().getEndpointUrl()))
                    .verifyComplete();
        }
        assertEquals(1, upstream.calls().stream().filter(B::equals).count());

        upstream.respond(B, 200, "back");
        clock.advance(Duration.ofSeconds(30));
        prober.probeAll().block();

        assertEquals(MonitoringService.HEALTHY, monitoring.serviceHealth("content").getStatus());
        assertEquals(3, content.healthyEndpoints().size());
        assertEquals(6L, context.getMetrics().getTotalRequests());
    }

    @Test
    void allEndpointsDownMakesTheGatewayDegraded() {
        probe.down(A).down(B).down(C);
        prober.probeAll().block();

        assertEquals(MonitoringService.UNHEALTHY, monitoring.serviceHealth("content").getStatus());
        assertEquals(MonitoringService.DEGRADED, monitoring.overallHealth().get("status"));

        StepVerifier.create(proxyService.handle(get("/api/v1/content/1")))
                .expectErrorMessage("content service is temporarily unavailable")
                .verify();
        assertEquals(0, upstream.calls().size());
    }
}

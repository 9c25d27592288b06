package com.watchflixx.gateway.service;

import com.watchflixx.gateway.config.GatewayProperties;
import com.watchflixx.gateway.core.GatewayContext;
import com.watchflixx.gateway.core.balancer.LoadBalancer;
import com.watchflixx.gateway.core.balancer.LoadBalancerRegistry;
import com.watchflixx.gateway.core.balancer.LoadBalancingSettings;
import com.watchflixx.gateway.core.breaker.CircuitBreakerRegistry;
import com.watchflixx.gateway.core.breaker.CircuitBreakerSettings;
import com.watchflixx.gateway.core.breaker.CircuitStateListener;
import com.watchflixx.gateway.core.heartbeat.HealthProber;
import com.watchflixx.gateway.core.metrics.MetricsAggregator;
import com.watchflixx.gateway.core.metrics.MetricsSettings;
import com.watchflixx.gateway.core.rate.InMemoryRateLimitStore;
import com.watchflixx.gateway.core.rate.RateLimitSettings;
import com.watchflixx.gateway.core.rate.RateLimiter;
import com.watchflixx.gateway.dto.AddEndpointRequest;
import com.watchflixx.gateway.dto.CircuitBreakerStatusDto;
import com.watchflixx.gateway.dto.UpdateWeightRequest;
import com.watchflixx.gateway.error.NotFoundException;
import com.watchflixx.gateway.error.ValidationException;
import com.watchflixx.gateway.support.FakeHealthProbe;
import com.watchflixx.gateway.support.FakeUpstreamClient;
import com.watchflixx.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdminServiceTest {

    private static final String STREAMING_A = "http://streaming-a:3003";
    private static final String STREAMING_B = "http://streaming-b:3003";

    private FakeUpstreamClient upstream;
    private FakeHealthProbe probe;
    private GatewayContext context;
    private GatewayProperties properties;
    private AdminService adminService;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T12:00:00Z");
        upstream = new FakeUpstreamClient();
        probe = new FakeHealthProbe();
        LoadBalancerRegistry balancers = new LoadBalancerRegistry(upstream, clock);
        balancers.register("streaming", LoadBalancingSettings.defaultSettings()).addEndpoint(STREAMING_A, 2);
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(CircuitBreakerSettings.defaultSettings(), Map.of(),
                clock, CircuitStateListener.NO_OP);
        context = new GatewayContext(balancers, breakers, new MetricsAggregator(MetricsSettings.defaultSettings(), clock), clock);

        properties = new GatewayProperties();
        properties.setAdminApiKeys(List.of("secret-admin-key"));
        RateLimiter rateLimiter = new RateLimiter(new InMemoryRateLimitStore(clock), RateLimitSettings.defaultSettings(), clock);
        HealthProber prober = new HealthProber(balancers, probe, Duration.ofSeconds(30), clock);
        adminService = new AdminService(context, prober, rateLimiter, new RouteTable(List.of()), properties);
    }

    private LoadBalancer streaming() {
        return context.getLoadBalancers().require("streaming");
    }

    @Test
    void addedEndpointIsProbedBeforeJoiningRotation() {
        StepVerifier.create(adminService.addEndpoint("streaming", new AddEndpointRequest(STREAMING_B, 3)))
                .assertNext(status -> {
                    assertEquals(STREAMING_B, status.getUrl());
                    assertEquals(3, status.getWeight());
                })
                .verifyComplete();

        assertTrue(probe.probed().contains(STREAMING_B));
        assertTrue(streaming().findEndpoint(STREAMING_B).orElseThrow().isHealthy());
    }

    @Test
    void endpointThatFailsItsFirstProbeStaysOutOfRotation() {
        probe.down(STREAMING_B);

        StepVerifier.create(adminService.addEndpoint("streaming", new AddEndpointRequest(STREAMING_B, null)))
                .expectNextCount(1)
                .verifyComplete();

        assertFalse(streaming().findEndpoint(STREAMING_B).orElseThrow().isHealthy());
        assertEquals(1, streaming().findEndpoint(STREAMING_B).orElseThrow().getWeight());
    }

    @Test
    void addEndpointValidatesInput() {
        StepVerifier.create(adminService.addEndpoint("streaming", new AddEndpointRequest(STREAMING_B, 0)))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(adminService.addEndpoint("streaming", new AddEndpointRequest(STREAMING_A, 1)))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(adminService.addEndpoint("billing", new AddEndpointRequest(STREAMING_B, 1)))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void removeEndpointReleasesItsClient() {
        adminService.removeEndpoint("streaming", STREAMING_A);

        assertTrue(streaming().getEndpoints().isEmpty());
        assertEquals(List.of(STREAMING_A), upstream.released());
        assertThrows(NotFoundException.class, () -> adminService.removeEndpoint("streaming", STREAMING_A));
        assertThrows(ValidationException.class, () -> adminService.removeEndpoint("streaming", " "));
    }

    @Test
    void updateWeightRequiresPositiveWeight() {
        assertEquals(5, adminService.updateWeight("streaming", new UpdateWeightRequest(STREAMING_A, 5)).getWeight());
        assertThrows(ValidationException.class,
                () -> adminService.updateWeight("streaming", new UpdateWeightRequest(STREAMING_A, 0)));
        assertThrows(NotFoundException.class,
                () -> adminService.updateWeight("streaming", new UpdateWeightRequest(STREAMING_B, 2)));
    }

    @Test
    void breakerCanBeForcedForKnownServicesOnly() {
        CircuitBreakerStatusDto opened = adminService.openCircuitBreaker("streaming");
        assertEquals("OPEN", opened.getState());

        CircuitBreakerStatusDto reset = adminService.resetCircuitBreaker("streaming");
        assertEquals("CLOSED", reset.getState());
        assertEquals(0, reset.getFailureCount());

        assertThrows(NotFoundException.class, () -> adminService.openCircuitBreaker("billing"));
    }

    @Test
    void slowEndpointLimitIsClamped() {
        assertEquals(10, adminService.clampSlowEndpointLimit(null));
        assertEquals(1, adminService.clampSlowEndpointLimit(-4));
        assertEquals(100, adminService.clampSlowEndpointLimit(5000));
        assertEquals(25, adminService.clampSlowEndpointLimit(25));
    }

    @Test
    void configNeverExposesAdminKeys() {
        Map<String, Object> config = adminService.getConfig();

        assertEquals("1 configured", config.get("adminApiKeys"));
        assertFalse(config.toString().contains("secret-admin-key"));
        assertTrue(((Map<?, ?>) config.get("services")).containsKey("streaming"));
        assertTrue(((Map<?, ?>) config.get("rateLimitPolicies")).containsKey("subscription"));
    }
}

package com.watchflixx.gateway.core.balancer;

import com.watchflixx.gateway.core.heartbeat.ProbeResult;
import com.watchflixx.gateway.core.model.Endpoint;
import com.watchflixx.gateway.dto.HealthSummaryDto;
import com.watchflixx.gateway.error.ValidationException;
import com.watchflixx.gateway.support.FakeUpstreamClient;
import com.watchflixx.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoadBalancerTest {

    private static final String A = "http://a:3000";
    private static final String B = "http://b:3000";
    private static final String C = "http://c:3000";

    private MutableClock clock;
    private FakeUpstreamClient upstream;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        upstream = new FakeUpstreamClient();
    }

    private LoadBalancer pool(LoadBalancingStrategy strategy, String... urls) {
        LoadBalancingSettings settings = LoadBalancingSettings.defaultSettings();
        settings.setStrategy(strategy);
        LoadBalancer balancer = new LoadBalancer("content", settings, upstream, clock);
        for (String url : urls) {
            balancer.addEndpoint(url, 1).markHealthy(5, Instant.now(clock));
        }
        return balancer;
    }

    private static String select(LoadBalancer balancer) {
        return balancer.selectNext().map(Endpoint::getUrl).orElse(null);
    }

    @Test
    void roundRobinCyclesInRegistrationOrder() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.ROUND_ROBIN, A, B, C);

        assertEquals(A, select(balancer));
        assertEquals(B, select(balancer));
        assertEquals(C, select(balancer));
        assertEquals(A, select(balancer));
    }

    @Test
    void selectionSkipsUnhealthyEndpoints() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.ROUND_ROBIN, A, B, C);
        balancer.findEndpoint(B).orElseThrow().markUnhealthy("down", null, Instant.now(clock));

        for (int i = 0; i < 20; i++) {
            assertFalse(B.equals(select(balancer)));
        }
    }

    @Test
    void selectionIsEmptyWhenNoEndpointIsHealthy() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.ROUND_ROBIN, A, B);
        for (Endpoint endpoint : balancer.getEndpoints()) {
            endpoint.markUnhealthy("down", null, Instant.now(clock));
        }

        assertEquals(Optional.empty(), balancer.selectNext());
    }

    @Test
    void newEndpointsAreNotSelectedBeforeFirstProbe() {
        LoadBalancer balancer = new LoadBalancer("content", LoadBalancingSettings.defaultSettings(), upstream, clock);
        balancer.addEndpoint(A, 1);

        assertTrue(balancer.selectNext().isEmpty());

        balancer.applyProbeResult(balancer.findEndpoint(A).orElseThrow(), ProbeResult.healthy(200, 4));
        assertEquals(A, select(balancer));
    }

    @Test
    void weightedSelectionConvergesToWeightShare() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.WEIGHTED);
        balancer.addEndpoint(A, 1).markHealthy(5, Instant.now(clock));
        balancer.addEndpoint(B, 3).markHealthy(5, Instant.now(clock));

        int samples = 60_000;
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < samples; i++) {
            counts.merge(select(balancer), 1, Integer::sum);
        }

        double shareA = counts.getOrDefault(A, 0) / (double) samples;
        double shareB = counts.getOrDefault(B, 0) / (double) samples;
        assertEquals(0.25, shareA, 0.02);
        assertEquals(0.75, shareB, 0.02);
    }

    @Test
    void leastConnectionsPrefersIdleEndpointAndBreaksTiesByOrder() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.LEAST_CONNECTIONS, A, B, C);
        assertEquals(A, select(balancer));

        balancer.findEndpoint(A).orElseThrow().incrementConnections();
        balancer.findEndpoint(B).orElseThrow().incrementConnections();
        assertEquals(C, select(balancer));

        balancer.findEndpoint(C).orElseThrow().incrementConnections();
        balancer.findEndpoint(C).orElseThrow().incrementConnections();
        assertEquals(A, select(balancer));
    }

    @Test
    void randomOnlyReturnsHealthyEndpoints() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.RANDOM, A, B, C);
        balancer.findEndpoint(C).orElseThrow().markUnhealthy("down", null, Instant.now(clock));

        List<String> seen = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            seen.add(select(balancer));
        }
        assertTrue(seen.contains(A));
        assertTrue(seen.contains(B));
        assertFalse(seen.contains(C));
    }

    @Test
    void duplicateAndEmptyEndpointsAreRejected() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.ROUND_ROBIN, A);

        assertThrows(ValidationException.class, () -> balancer.addEndpoint(A + "/", 1));
        assertThrows(ValidationException.class, () -> balancer.addEndpoint(" ", 1));
        assertEquals(1, balancer.getEndpoints().size());
    }

    @Test
    void removeEndpointReleasesItsClient() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.ROUND_ROBIN, A, B);

        assertTrue(balancer.removeEndpoint(A));
        assertFalse(balancer.removeEndpoint(A));
        assertEquals(List.of(A), upstream.released());
        assertEquals(B, select(balancer));
    }

    @Test
    void updateWeightNeverGoesBelowOne() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.WEIGHTED, A);

        assertTrue(balancer.updateWeight(A, 5));
        assertEquals(5, balancer.findEndpoint(A).orElseThrow().getWeight());
        assertTrue(balancer.updateWeight(A, 0));
        assertEquals(1, balancer.findEndpoint(A).orElseThrow().getWeight());
        assertFalse(balancer.updateWeight(C, 3));
    }

    @Test
    void healthSummaryCountsEveryState() {
        LoadBalancer balancer = pool(LoadBalancingStrategy.ROUND_ROBIN, A, B);
        balancer.addEndpoint(C, 1);
        balancer.findEndpoint(B).orElseThrow().markUnhealthy("down", null, Instant.now(clock));

        HealthSummaryDto summary = balancer.getHealthSummary();
        assertEquals(3, summary.getTotal());
        assertEquals(1, summary.getHealthy());
        assertEquals(1, summary.getUnhealthy());
        assertEquals(1, summary.getUnknown());
        assertEquals(100.0 / 3, summary.getHealthyPercentage(), 0.001);
    }
}

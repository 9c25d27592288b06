package com.watchflixx.gateway.core.metrics;

import com.watchflixx.gateway.core.breaker.CircuitBreakerRegistry;
import com.watchflixx.gateway.core.breaker.CircuitBreakerSettings;
import com.watchflixx.gateway.core.breaker.LoggingCircuitStateListener;
import com.watchflixx.gateway.core.model.RequestMetric;
import com.watchflixx.gateway.support.MutableClock;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GatewayMeterBinderTest {

    private MutableClock clock;
    private MetricsAggregator aggregator;
    private CircuitBreakerRegistry breakers;
    private PrometheusMeterRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T12:00:00Z");
        aggregator = new MetricsAggregator(MetricsSettings.defaultSettings(), clock);
        breakers = new CircuitBreakerRegistry(CircuitBreakerSettings.defaultSettings(), Map.of(), clock,
                new LoggingCircuitStateListener());
        registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new GatewayMeterBinder(aggregator, breakers, List.of("content", "payment")).bindTo(registry);
    }

    private void record(int status, long responseTimeMs) {
        aggregator.record(RequestMetric.builder().timestamp(clock.millis()).method("GET").path("/a")
                .statusCode(status).responseTimeMs(responseTimeMs).serviceName("content").build());
    }

    @Test
    void countersFollowAggregatorTotals() {
        record(200, 20);
        record(502, 40);

        assertEquals(2.0, registry.get("watchflixx.gateway.requests").functionCounter().count());
        assertEquals(1.0, registry.get("watchflixx.gateway.errors").functionCounter().count());

        record(200, 10);
        assertEquals(3.0, registry.get("watchflixx.gateway.requests").functionCounter().count());
    }

    @Test
    void serviceGaugesAreTaggedAndReadLive() {
        record(200, 20);
        record(502, 40);

        assertEquals(2.0, registry.get("watchflixx.gateway.service.requests").tag("service", "content").gauge().value());
        assertEquals(1.0, registry.get("watchflixx.gateway.service.errors").tag("service", "content").gauge().value());
        assertEquals(0.0, registry.get("watchflixx.gateway.service.requests").tag("service", "payment").gauge().value());
        assertEquals(40.0, registry.get("watchflixx.gateway.response.time.ms").tag("quantile", "0.99").gauge().value());
    }

    @Test
    void breakerStateIsExportedPerService() {
        assertEquals(0.0, registry.get("watchflixx.gateway.circuit.breaker.state").tag("service", "payment").gauge().value());

        breakers.getOrCreate("payment").forceOpen();

        assertEquals(2.0, registry.get("watchflixx.gateway.circuit.breaker.state").tag("service", "payment").gauge().value());
        assertEquals(0.0, registry.get("watchflixx.gateway.circuit.breaker.state").tag("service", "content").gauge().value());
    }

    @Test
    void scrapeRendersPrometheusText() {
        record(200, 20);

        String text = registry.scrape();

        assertTrue(text.contains("# TYPE watchflixx_gateway_requests_total counter"));
        assertTrue(text.contains("watchflixx_gateway_health_score"));
        assertTrue(text.contains("watchflixx_gateway_circuit_breaker_state{service=\"payment\""));
    }
}

package com.watchflixx.gateway.core.metrics;

import com.watchflixx.gateway.core.breaker.CircuitBreakerRegistry;
import com.watchflixx.gateway.core.breaker.CircuitState;
import com.watchflixx.gateway.dto.AggregatedMetricsDto;
import com.watchflixx.gateway.dto.ResponseTimeDto;
import com.watchflixx.gateway.dto.ServiceBreakdownDto;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * 把 {@link MetricsAggregator} 和熔断器状态注册为 Micrometer 指标
 *
 * <p>所有指标在抓取时从聚合器实时读取，不另外保存计数。
 * 熔断器状态取值：0=closed，1=half-open，2=open。
 */
public class GatewayMeterBinder implements MeterBinder {

    static final String PREFIX = "watchflixx.gateway.";

    private final MetricsAggregator aggregator;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Collection<String> serviceNames;

    public GatewayMeterBinder(MetricsAggregator aggregator,
                              CircuitBreakerRegistry circuitBreakers,
                              Collection<String> serviceNames) {
        this.aggregator = aggregator;
        this.circuitBreakers = circuitBreakers;
        this.serviceNames = List.copyOf(serviceNames);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder(PREFIX + "requests", aggregator, MetricsAggregator::getTotalRequests)
                .description("Total requests handled by the gateway")
                .register(registry);
        FunctionCounter.builder(PREFIX + "errors", aggregator, MetricsAggregator::getTotalErrors)
                .description("Total requests answered with status >= 400")
                .register(registry);

        responseTime(registry, "0.5", ResponseTimeDto::getP50);
        responseTime(registry, "0.95", ResponseTimeDto::getP95);
        responseTime(registry, "0.99", ResponseTimeDto::getP99);
        Gauge.builder(PREFIX + "error.rate.percent", aggregator, a -> valueOf(a.getAggregatedMetrics().getErrorRate()))
                .description("Error rate over the aggregation window")
                .register(registry);
        Gauge.builder(PREFIX + "health.score", aggregator, a -> valueOf(a.getHealthScore().getScore()))
                .description("Composite gateway health score (0-100)")
                .register(registry);

        for (String service : serviceNames) {
            serviceGauge(registry, "service.requests", service, "Requests per backend service over the aggregation window",
                    ServiceBreakdownDto::getRequestCount);
            serviceGauge(registry, "service.errors", service, "Errors per backend service over the aggregation window",
                    ServiceBreakdownDto::getErrorCount);
            serviceGauge(registry, "service.response.time.ms", service, "Average response time per backend service",
                    ServiceBreakdownDto::getAverageResponseTime);
            Gauge.builder(PREFIX + "circuit.breaker.state", circuitBreakers, breakers -> breakerValue(breakers, service))
                    .description("Circuit breaker state per service (0=closed, 1=half-open, 2=open)")
                    .tag("service", service)
                    .register(registry);
        }
    }

    private void responseTime(MeterRegistry registry, String quantile, Function<ResponseTimeDto, Number> reader) {
        Gauge.builder(PREFIX + "response.time.ms", aggregator,
                        a -> valueOf(reader.apply(a.getAggregatedMetrics().getResponseTime())))
                .description("Response time over the aggregation window in milliseconds")
                .tag("quantile", quantile)
                .register(registry);
    }

    private void serviceGauge(MeterRegistry registry, String name, String service, String description,
                              Function<ServiceBreakdownDto, Number> reader) {
        ToDoubleFunction<MetricsAggregator> value = a -> {
            AggregatedMetricsDto aggregated = a.getAggregatedMetrics();
            ServiceBreakdownDto breakdown = aggregated.getServices().get(service);
            return breakdown == null ? 0 : valueOf(reader.apply(breakdown));
        };
        Gauge.builder(PREFIX + name, aggregator, value)
                .description(description)
                .tag("service", service)
                .register(registry);
    }

    static double breakerValue(CircuitBreakerRegistry registry, String service) {
        CircuitState state = registry.states().get(service);
        if (state == null) {
            return 0;
        }
        switch (state) {
            case OPEN:
                return 2;
            case HALF_OPEN:
                return 1;
            default:
                return 0;
        }
    }

    private static double valueOf(Number value) {
        return value == null ? 0 : value.doubleValue();
    }
}

package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.GatewayContext;
import com.watchflixx.gateway.core.balancer.LoadBalancer;
import com.watchflixx.gateway.core.breaker.CircuitBreaker;
import com.watchflixx.gateway.core.breaker.CircuitState;
import com.watchflixx.gateway.core.metrics.MetricsAggregator;
import com.watchflixx.gateway.dto.DashboardDto;
import com.watchflixx.gateway.dto.HealthSummaryDto;
import com.watchflixx.gateway.dto.PoolStatsDto;
import com.watchflixx.gateway.dto.ServiceHealthDto;
import com.watchflixx.gateway.dto.SystemInfoDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.RuntimeMXBean;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 监控视图：服务健康、看板与进程信息
 */
@Service
@Slf4j
public class MonitoringService {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String UNHEALTHY = "unhealthy";

    private static final int DASHBOARD_SLOW_ENDPOINTS = 10;

    private final GatewayContext context;
    private final InflightRequestTracker inflightTracker;

    public MonitoringService(GatewayContext context, InflightRequestTracker inflightTracker) {
        this.context = context;
        this.inflightTracker = inflightTracker;
    }

    /**
     * 服务状态：没有健康端点或熔断打开为 unhealthy，部分端点不健康或熔断半开为 degraded
     */
    public ServiceHealthDto serviceHealth(String serviceName) {
        LoadBalancer balancer = context.getLoadBalancers().require(serviceName);
        PoolStatsDto stats = balancer.getStats();
        HealthSummaryDto summary = balancer.getHealthSummary();
        CircuitState circuitState = context.getCircuitBreakers().find(serviceName)
                .map(CircuitBreaker::getState)
                .orElse(null);

        String status;
        if (summary.getHealthy() == 0 || circuitState == CircuitState.OPEN) {
            status = UNHEALTHY;
        } else if (summary.getHealthy() < summary.getTotal() || circuitState == CircuitState.HALF_OPEN) {
            status = DEGRADED;
        } else {
            status = HEALTHY;
        }

        ServiceHealthDto dto = new ServiceHealthDto();
        dto.setServiceName(serviceName);
        dto.setStatus(status);
        dto.setCircuitState(circuitState == null ? null : circuitState.name());
        dto.setSummary(summary);
        dto.setLastHealthCheck(stats.getLastHealthCheck());
        dto.setEndpoints(stats.getEndpoints());
        return dto;
    }

    public List<ServiceHealthDto> allServicesHealth() {
        return context.getLoadBalancers().serviceNames().stream()
                .map(this::serviceHealth)
                .collect(Collectors.toList());
    }

    /**
     * 网关整体健康：每个服务池至少有一个健康端点时为 healthy，否则 degraded
     */
    public Map<String, Object> overallHealth() {
        List<ServiceHealthDto> services = allServicesHealth();
        boolean healthy = services.stream().allMatch(s -> s.getSummary().getHealthy() > 0);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? HEALTHY : DEGRADED);
        body.put("timestamp", Instant.now(context.getClock()).toString());
        body.put("uptimeSeconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        Map<String, Object> perService = new LinkedHashMap<>();
        for (ServiceHealthDto service : services) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", service.getStatus());
            entry.put("healthyEndpoints", service.getSummary().getHealthy());
            entry.put("totalEndpoints", service.getSummary().getTotal());
            entry.put("circuitState", service.getCircuitState());
            perService.put(service.getServiceName(), entry);
        }
        body.put("services", perService);
        return body;
    }

    public boolean isOverallHealthy(Map<String, Object> overall) {
        return HEALTHY.equals(overall.get("status"));
    }

    public SystemInfoDto systemInfo() {
        RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        SystemInfoDto dto = new SystemInfoDto();
        dto.setStartTime(Instant.ofEpochMilli(runtime.getStartTime()).toString());
        dto.setUptimeSeconds(runtime.getUptime() / 1000);
        dto.setJavaVersion(System.getProperty("java.version"));
        dto.setAvailableProcessors(Runtime.getRuntime().availableProcessors());
        dto.setHeapUsed(heap.getUsed());
        dto.setHeapMax(heap.getMax());
        dto.setThreadCount(ManagementFactory.getThreadMXBean().getThreadCount());
        dto.setInflightRequests(inflightTracker.inflight());
        dto.setPeakInflightRequests(inflightTracker.peak());
        dto.setBufferedMetrics(context.getMetrics().size());
        return dto;
    }

    public DashboardDto dashboard() {
        MetricsAggregator metrics = context.getMetrics();
        DashboardDto dto = new DashboardDto();
        dto.setOverview(metrics.getAggregatedMetrics());
        dto.setHealthScore(metrics.getHealthScore());
        dto.setServices(allServicesHealth());
        dto.setCircuitBreakers(context.getCircuitBreakers().snapshots());
        dto.setTrafficPatterns(metrics.getTrafficPatterns());
        dto.setSlowEndpoints(metrics.getSlowEndpoints(DASHBOARD_SLOW_ENDPOINTS));
        dto.setErrorDistribution(metrics.getErrorDistribution());
        dto.setSystem(systemInfo());
        return dto;
    }
}

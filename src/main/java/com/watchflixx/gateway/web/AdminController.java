package com.watchflixx.gateway.web;

import com.watchflixx.gateway.core.GatewayContext;
import com.watchflixx.gateway.dto.AddEndpointRequest;
import com.watchflixx.gateway.dto.AggregatedMetricsDto;
import com.watchflixx.gateway.dto.ApiResponse;
import com.watchflixx.gateway.dto.CircuitBreakerStatusDto;
import com.watchflixx.gateway.dto.DashboardDto;
import com.watchflixx.gateway.dto.EndpointStatusDto;
import com.watchflixx.gateway.dto.ErrorDistributionDto;
import com.watchflixx.gateway.dto.HealthScoreDto;
import com.watchflixx.gateway.dto.PoolStatsDto;
import com.watchflixx.gateway.dto.ServiceHealthDto;
import com.watchflixx.gateway.dto.ServiceMetricsDto;
import com.watchflixx.gateway.dto.SlowEndpointDto;
import com.watchflixx.gateway.dto.SystemInfoDto;
import com.watchflixx.gateway.dto.TrafficBucketDto;
import com.watchflixx.gateway.dto.UpdateWeightRequest;
import com.watchflixx.gateway.dto.UserActivityDto;
import com.watchflixx.gateway.service.AdminService;
import com.watchflixx.gateway.service.MonitoringService;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Tag(name = "管理控制器", description = "网关指标、熔断器与服务端点的运维接口，需要 X-API-Key")
public class AdminController {

    private final AdminService adminService;
    private final MonitoringService monitoringService;
    private final GatewayContext context;
    private final ResponseEnvelope envelope;
    private final PrometheusMeterRegistry prometheusRegistry;

    // ---------------------------------------------------------------- 指标

    @Operation(summary = "聚合指标", description = "最近一个统计窗口内的请求量、错误率、响应时间分位数和按服务拆分")
    @GetMapping("/metrics")
    public ApiResponse<AggregatedMetricsDto> metrics(ServerWebExchange exchange) {
        return envelope.ok(context.getMetrics().getAggregatedMetrics(), exchange);
    }

    @Operation(summary = "单个服务指标", description = "该服务在窗口内没有任何记录时返回 404")
    @GetMapping("/metrics/{service}")
    public ApiResponse<ServiceMetricsDto> serviceMetrics(@PathVariable("service") String service,
                                                         ServerWebExchange exchange) {
        return envelope.ok(adminService.getServiceMetrics(service), exchange);
    }

    @Operation(summary = "Prometheus 指标", description = "文本格式 0.0.4，供 Prometheus 抓取")
    @GetMapping("/metrics/prometheus")
    public ResponseEntity<String> prometheus() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004)
                .body(prometheusRegistry.scrape());
    }

    @Operation(summary = "重置指标", description = "清空指标缓冲区与累计计数")
    @PostMapping("/metrics/reset")
    public ApiResponse<Void> resetMetrics(ServerWebExchange exchange) {
        adminService.resetMetrics();
        return envelope.ok(null, "Metrics reset", exchange);
    }

    @Operation(summary = "慢接口排行", description = "按平均响应时间倒序")
    @GetMapping("/performance/slow-endpoints")
    public ApiResponse<List<SlowEndpointDto>> slowEndpoints(
            @Parameter(description = "返回条数，1-100，默认 10") @RequestParam(value = "limit", required = false) Integer limit,
            ServerWebExchange exchange) {
        int clamped = adminService.clampSlowEndpointLimit(limit);
        return envelope.ok(context.getMetrics().getSlowEndpoints(clamped), exchange);
    }

    @Operation(summary = "错误分布", description = "按状态码、服务和接口统计错误")
    @GetMapping("/errors/distribution")
    public ApiResponse<ErrorDistributionDto> errorDistribution(ServerWebExchange exchange) {
        return envelope.ok(context.getMetrics().getErrorDistribution(), exchange);
    }

    @Operation(summary = "流量分布", description = "最近一小时按 5 分钟分桶")
    @GetMapping("/traffic/patterns")
    public ApiResponse<List<TrafficBucketDto>> trafficPatterns(ServerWebExchange exchange) {
        return envelope.ok(context.getMetrics().getTrafficPatterns(), exchange);
    }

    @Operation(summary = "用户活跃度", description = "活跃用户数与请求量最高的用户")
    @GetMapping("/users/activity")
    public ApiResponse<UserActivityDto> userActivity(ServerWebExchange exchange) {
        return envelope.ok(context.getMetrics().getUserActivity(), exchange);
    }

    @Operation(summary = "综合健康评分", description = "由错误率、P95、吞吐量和可用率加权得出")
    @GetMapping("/health/score")
    public ApiResponse<HealthScoreDto> healthScore(ServerWebExchange exchange) {
        return envelope.ok(context.getMetrics().getHealthScore(), exchange);
    }

    @Operation(summary = "运维看板", description = "一次返回看板需要的全部数据")
    @GetMapping("/dashboard")
    public ApiResponse<DashboardDto> dashboard(ServerWebExchange exchange) {
        return envelope.ok(monitoringService.dashboard(), exchange);
    }

    // ---------------------------------------------------------------- 熔断器

    @Operation(summary = "熔断器列表", description = "所有已创建熔断器的状态和计数")
    @GetMapping("/circuit-breakers")
    public ApiResponse<List<CircuitBreakerStatusDto>> circuitBreakers(ServerWebExchange exchange) {
        return envelope.ok(adminService.getCircuitBreakers(), exchange);
    }

    @Operation(summary = "重置熔断器", description = "强制关闭并清零计数")
    @PostMapping("/circuit-breakers/{service}/reset")
    public ApiResponse<CircuitBreakerStatusDto> resetCircuitBreaker(@PathVariable("service") String service,
                                                                    ServerWebExchange exchange) {
        return envelope.ok(adminService.resetCircuitBreaker(service), "Circuit breaker reset", exchange);
    }

    @Operation(summary = "打开熔断器", description = "强制打开，在重置超时前拒绝该服务的所有请求")
    @PostMapping("/circuit-breakers/{service}/open")
    public ApiResponse<CircuitBreakerStatusDto> openCircuitBreaker(@PathVariable("service") String service,
                                                                   ServerWebExchange exchange) {
        return envelope.ok(adminService.openCircuitBreaker(service), "Circuit breaker opened", exchange);
    }

    // ---------------------------------------------------------------- 负载均衡

    @Operation(summary = "负载均衡统计", description = "各服务池的策略、端点健康和连接数")
    @GetMapping("/load-balancers")
    public ApiResponse<List<PoolStatsDto>> loadBalancers(ServerWebExchange exchange) {
        return envelope.ok(adminService.getLoadBalancers(), exchange);
    }

    @Operation(
        summary = "新增端点",
        description = "注册后立即探测一次，探测通过才参与选择",
        requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
            description = "端点信息",
            content = @Content(schema = @Schema(implementation = AddEndpointRequest.class))
        )
    )
    @ApiResponses({
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "成功添加端点"),
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "地址为空、重复或权重非法"),
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "未知服务")
    })
    @PostMapping("/load-balancers/{service}/endpoints")
    public Mono<ApiResponse<EndpointStatusDto>> addEndpoint(@PathVariable("service") String service,
                                                            @RequestBody AddEndpointRequest request,
                                                            ServerWebExchange exchange) {
        return adminService.addEndpoint(service, request)
                .map(status -> envelope.ok(status, "Endpoint added", exchange));
    }

    @Operation(summary = "移除端点", description = "同时释放该端点的连接池")
    @DeleteMapping("/load-balancers/{service}/endpoints")
    public ApiResponse<Void> removeEndpoint(@PathVariable("service") String service,
                                            @Parameter(description = "端点基础 URL") @RequestParam(value = "url", required = false) String url,
                                            ServerWebExchange exchange) {
        adminService.removeEndpoint(service, url);
        return envelope.ok(null, "Endpoint removed", exchange);
    }

    @Operation(summary = "调整端点权重", description = "只影响 weighted 策略")
    @PutMapping("/load-balancers/{service}/endpoints/weight")
    public ApiResponse<EndpointStatusDto> updateWeight(@PathVariable("service") String service,
                                                       @RequestBody UpdateWeightRequest request,
                                                       ServerWebExchange exchange) {
        return envelope.ok(adminService.updateWeight(service, request), "Weight updated", exchange);
    }

    // ---------------------------------------------------------------- 系统

    @Operation(summary = "服务健康列表", description = "各服务的端点健康与熔断状态")
    @GetMapping("/services/health")
    public ApiResponse<List<ServiceHealthDto>> servicesHealth(ServerWebExchange exchange) {
        return envelope.ok(monitoringService.allServicesHealth(), exchange);
    }

    @Operation(summary = "进程信息", description = "运行时长、内存、线程和飞行中请求数")
    @GetMapping("/system")
    public ApiResponse<SystemInfoDto> system(ServerWebExchange exchange) {
        return envelope.ok(monitoringService.systemInfo(), exchange);
    }

    @Operation(summary = "当前配置", description = "生效中的网关配置，不包含密钥")
    @GetMapping("/config")
    public ApiResponse<Map<String, Object>> config(ServerWebExchange exchange) {
        return envelope.ok(adminService.getConfig(), exchange);
    }
}

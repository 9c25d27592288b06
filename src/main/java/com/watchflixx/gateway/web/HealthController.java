package com.watchflixx.gateway.web;

import com.watchflixx.gateway.dto.ApiResponse;
import com.watchflixx.gateway.dto.ServiceHealthDto;
import com.watchflixx.gateway.service.MonitoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "健康检查", description = "网关及后端服务的公开健康状态")
public class HealthController {

    private final MonitoringService monitoringService;
    private final ResponseEnvelope envelope;

    @Operation(summary = "网关整体健康", description = "任一服务池没有健康端点时返回 503")
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health(ServerWebExchange exchange) {
        Map<String, Object> overall = monitoringService.overallHealth();
        HttpStatus status = monitoringService.isOverallHealthy(overall) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(envelope.ok(overall, exchange));
    }

    @Operation(summary = "单个服务健康", description = "服务不健康时返回 503，未知服务返回 404")
    @GetMapping("/health/{service}")
    public ResponseEntity<ApiResponse<ServiceHealthDto>> serviceHealth(@PathVariable("service") String service,
                                                                       ServerWebExchange exchange) {
        ServiceHealthDto health = monitoringService.serviceHealth(service);
        HttpStatus status = MonitoringService.UNHEALTHY.equals(health.getStatus())
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(envelope.ok(health, exchange));
    }
}

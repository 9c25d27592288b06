package com.watchflixx.gateway.core.heartbeat;

import com.watchflixx.gateway.core.balancer.LoadBalancer;
import com.watchflixx.gateway.core.balancer.LoadBalancerRegistry;
import com.watchflixx.gateway.core.balancer.LoadBalancingSettings;
import com.watchflixx.gateway.core.model.Endpoint;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 周期性健康探测
 *
 * <p>每个周期并发探测所有服务池的全部端点，等全部探测结束后才开始计算下一周期的间隔，
 * 因此两个周期不会重叠。探测运行在独立的守护线程上，不占用请求处理线程。
 */
@Slf4j
public class HealthProber {

    private final LoadBalancerRegistry registry;
    private final HealthProbe probe;
    private final Duration interval;
    private final Clock clock;

    private ScheduledExecutorService scheduler;

    public HealthProber(LoadBalancerRegistry registry, HealthProbe probe, Duration interval, Clock clock) {
        this.registry = registry;
        this.probe = probe;
        this.interval = interval;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-prober");
            t.setDaemon(true);
            return t;
        });
        // 启动后立即探测一次，端点在首次探测前为 unknown，不参与选择
        scheduler.scheduleWithFixedDelay(this::runCycle, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("HealthProber started, interval={}ms", interval.toMillis());
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("HealthProber did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runCycle() {
        try {
            probeAll().block();
        } catch (RuntimeException e) {
            // 异常不能逃出调度线程，否则后续周期会被取消
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * 并发探测所有端点，全部完成后结束
     */
    public Mono<Void> probeAll() {
        return Flux.fromIterable(registry.all())
                .flatMap(this::probePool)
                .then();
    }

    public Mono<Void> probePool(LoadBalancer balancer) {
        return Flux.fromIterable(balancer.getEndpoints())
                .flatMap(endpoint -> probeEndpoint(balancer, endpoint))
                .then(Mono.fromRunnable(() -> balancer.recordHealthCheck(Instant.now(clock))))
                .doOnSubscribe(s -> log.debug("Probing {} endpoints of service {}",
                        balancer.getEndpoints().size(), balancer.getServiceName()))
                .then();
    }

    /**
     * 探测单个端点并写回结果
     */
    public Mono<ProbeResult> probeEndpoint(LoadBalancer balancer, Endpoint endpoint) {
        LoadBalancingSettings settings = balancer.getSettings();
        Duration timeout = settings.getHealthCheckTimeout();
        return Mono.defer(() -> probe.probe(endpoint, settings.getHealthPath(), timeout))
                // 探测实现未遵守超时时兜底
                .timeout(timeout.plusSeconds(1))
                .onErrorResume(error -> Mono.just(ProbeResult.unhealthy(null, timeout.toMillis(),
                        error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage())))
                .doOnNext(result -> balancer.applyProbeResult(endpoint, result));
    }
}

package com.watchflixx.gateway.core.balancer;

import com.watchflixx.gateway.core.client.UpstreamClient;
import com.watchflixx.gateway.core.client.UpstreamException;
import com.watchflixx.gateway.core.client.UpstreamFailures;
import com.watchflixx.gateway.core.client.UpstreamRequest;
import com.watchflixx.gateway.core.client.UpstreamResponse;
import com.watchflixx.gateway.core.heartbeat.ProbeResult;
import com.watchflixx.gateway.core.model.Endpoint;
import com.watchflixx.gateway.core.model.EndpointHealth;
import com.watchflixx.gateway.core.model.HealthStatus;
import com.watchflixx.gateway.dto.EndpointStatusDto;
import com.watchflixx.gateway.dto.HealthSummaryDto;
import com.watchflixx.gateway.dto.PoolStatsDto;
import com.watchflixx.gateway.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个后端服务池的负载均衡器
 *
 * <p>同时承担该服务池的端点注册表职责：
 * <ul>
 *   <li><b>端点注册</b>：增删端点、调整权重，写操作在池级锁内完成</li>
 *   <li><b>端点选择</b>：只在健康端点中按策略选择，没有健康端点时返回空</li>
 *   <li><b>调用与重试</b>：连接类失败立即把端点标记为不健康，按指数退避重试</li>
 * </ul>
 *
 * <p>选择过程读取端点列表快照，不持有锁；轮询游标是原子计数器，
 * 并发选择时不保证严格公平，但游标总是按当前健康集合大小取模前进。
 */
@Slf4j
public class LoadBalancer {

    private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(30);

    private final String serviceName;
    private final LoadBalancingSettings settings;
    private final UpstreamClient upstreamClient;
    private final Clock clock;

    /** 端点列表，读多写少 */
    private final List<Endpoint> endpoints = new CopyOnWriteArrayList<>();
    /** 池级写锁，保护增删与查重 */
    private final Object registryLock = new Object();
    private final AtomicInteger cursor = new AtomicInteger(0);
    private final AtomicInteger endpointSequence = new AtomicInteger(0);
    private volatile Instant lastHealthCheck;

    public LoadBalancer(String serviceName, LoadBalancingSettings settings, UpstreamClient upstreamClient, Clock clock) {
        this.serviceName = serviceName;
        this.settings = settings.copy();
        this.upstreamClient = upstreamClient;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- 注册表

    /**
     * 注册端点，初始状态为 unknown，需要探测后才会参与选择
     *
     * @throws ValidationException 地址为空或已注册
     */
    public Endpoint addEndpoint(String url, int weight) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Endpoint url must not be empty");
        }
        String normalized = Endpoint.normalizeUrl(url);
        synchronized (registryLock) {
            for (Endpoint existing : endpoints) {
                if (existing.getUrl().equals(normalized)) {
                    throw new ValidationException("Endpoint " + normalized + " is already registered for " + serviceName);
                }
            }
            Endpoint endpoint = new Endpoint(serviceName + "-" + endpointSequence.incrementAndGet(), normalized, weight);
            endpoints.add(endpoint);
            log.info("Registered endpoint {} for service {}", normalized, serviceName);
            return endpoint;
        }
    }

    public boolean removeEndpoint(String url) {
        Optional<Endpoint> removed;
        synchronized (registryLock) {
            removed = findEndpoint(url);
            removed.ifPresent(endpoints::remove);
        }
        removed.ifPresent(endpoint -> {
            upstreamClient.release(endpoint);
            log.info("Removed endpoint {} from service {}", endpoint.getUrl(), serviceName);
        });
        return removed.isPresent();
    }

    public boolean updateWeight(String url, int weight) {
        Optional<Endpoint> endpoint = findEndpoint(url);
        endpoint.ifPresent(e -> {
            e.setWeight(weight);
            log.info("Updated weight of endpoint {} ({}) to {}", e.getUrl(), serviceName, e.getWeight());
        });
        return endpoint.isPresent();
    }

    public Optional<Endpoint> findEndpoint(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String normalized = Endpoint.normalizeUrl(url);
        for (Endpoint endpoint : endpoints) {
            if (endpoint.getUrl().equals(normalized)) {
                return Optional.of(endpoint);
            }
        }
        return Optional.empty();
    }

    public List<Endpoint> getEndpoints() {
        return new ArrayList<>(endpoints);
    }

    public List<Endpoint> healthyEndpoints() {
        List<Endpoint> healthy = new ArrayList<>();
        for (Endpoint endpoint : endpoints) {
            if (endpoint.isHealthy()) {
                healthy.add(endpoint);
            }
        }
        return healthy;
    }

    // ---------------------------------------------------------------- 选择

    /**
     * 按配置的策略从健康端点中选择一个
     *
     * @return 没有健康端点时返回空，调用方应立即视为不可用
     */
    public Optional<Endpoint> selectNext() {
        List<Endpoint> healthy = healthyEndpoints();
        if (healthy.isEmpty()) {
            return Optional.empty();
        }
        switch (settings.getStrategy()) {
            case LEAST_CONNECTIONS:
                return Optional.of(leastConnections(healthy));
            case WEIGHTED:
                return Optional.of(weighted(healthy));
            case RANDOM:
                return Optional.of(healthy.get(ThreadLocalRandom.current().nextInt(healthy.size())));
            case ROUND_ROBIN:
            default:
                return Optional.of(healthy.get(Math.floorMod(cursor.getAndIncrement(), healthy.size())));
        }
    }

    // 连接数相同时取注册顺序靠前的端点
    private static Endpoint leastConnections(List<Endpoint> healthy) {
        Endpoint best = healthy.get(0);
        for (int i = 1; i < healthy.size(); i++) {
            Endpoint candidate = healthy.get(i);
            if (candidate.getCurrentConnections() < best.getCurrentConnections()) {
                best = candidate;
            }
        }
        return best;
    }

    // 累计权重采样：在 [0, Σweight) 取随机数，依次减去权重直到不大于 0
    private static Endpoint weighted(List<Endpoint> healthy) {
        int[] weights = new int[healthy.size()];
        long total = 0;
        for (int i = 0; i < healthy.size(); i++) {
            weights[i] = healthy.get(i).getWeight();
            total += weights[i];
        }
        double remaining = ThreadLocalRandom.current().nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            remaining -= weights[i];
            if (remaining <= 0) {
                return healthy.get(i);
            }
        }
        return healthy.get(0);
    }

    // ---------------------------------------------------------------- 调用

    public Mono<UpstreamResponse> execute(UpstreamRequest request) {
        return execute(request, settings.getRetryAttempts());
    }

    /**
     * 选择端点并发起调用，连接类失败时换端点重试
     *
     * <p>连接类失败（拒绝连接、DNS、超时、连接重置、后端 5xx）会立即把端点标记为不健康，
     * 因此重试自然落在其他端点上。重试前等待 {@code retryDelay * 2^attempt}；
     * 等待前若已没有健康端点则立即失败，不再退避。重试耗尽时抛出最后一次的失败。
     *
     * @param maxRetries 首次调用之外的最大重试次数
     */
    public Mono<UpstreamResponse> execute(UpstreamRequest request, int maxRetries) {
        return attempt(request, 0, Math.max(0, maxRetries), null);
    }

    private Mono<UpstreamResponse> attempt(UpstreamRequest request, int attempt, int maxRetries, UpstreamException lastError) {
        return Mono.defer(() -> {
            Optional<Endpoint> selected = selectNext();
            if (selected.isEmpty()) {
                return Mono.error(new NoHealthyEndpointException(serviceName, lastError));
            }
            Endpoint endpoint = selected.get();
            return call(endpoint, request)
                    .onErrorResume(UpstreamException.class, failure -> {
                        if (attempt >= maxRetries) {
                            log.warn("Service {} exhausted {} retries, last failure: {}",
                                    serviceName, maxRetries, failure.getMessage());
                            return Mono.error(failure);
                        }
                        if (healthyEndpoints().isEmpty()) {
                            return Mono.error(new NoHealthyEndpointException(serviceName, failure));
                        }
                        Duration backoff = settings.getRetryDelay().multipliedBy(1L << Math.min(attempt, 20));
                        log.debug("Retrying {} request {} in {}ms (attempt {}/{})",
                                serviceName, request.getRequestId(), backoff.toMillis(), attempt + 1, maxRetries);
                        return Mono.delay(backoff).then(attempt(request, attempt + 1, maxRetries, failure));
                    });
        });
    }

    /**
     * 不经过健康筛选，直接调用第一个注册的端点，只尝试一次
     */
    public Mono<UpstreamResponse> executeDirect(UpstreamRequest request) {
        return Mono.defer(() -> {
            if (endpoints.isEmpty()) {
                return Mono.error(new NoHealthyEndpointException(serviceName, null));
            }
            return call(endpoints.get(0), request);
        });
    }

    // 单次调用：维护连接数、施加超时、把连接类失败归类并下线端点
    private Mono<UpstreamResponse> call(Endpoint endpoint, UpstreamRequest request) {
        Duration timeout = request.getTimeout() == null ? DEFAULT_CALL_TIMEOUT : request.getTimeout();
        return Mono.defer(() -> {
                    endpoint.incrementConnections();
                    return upstreamClient.send(endpoint, request)
                            .timeout(timeout)
                            .doFinally(signal -> endpoint.decrementConnections());
                })
                .flatMap(response -> response.isServerError()
                        ? Mono.<UpstreamResponse>error(UpstreamException.serverError(endpoint.getUrl(), response.getStatusCode()))
                        : Mono.just(response))
                .onErrorMap(error -> {
                    UpstreamException classified = UpstreamFailures.classify(error, endpoint.getUrl());
                    return classified == null ? error : classified;
                })
                .doOnError(UpstreamException.class, failure -> markFailed(endpoint, failure));
    }

    private void markFailed(Endpoint endpoint, UpstreamException failure) {
        boolean wasHealthy = endpoint.isHealthy();
        endpoint.markUnhealthy(failure.getMessage(), null, Instant.now(clock));
        if (wasHealthy) {
            log.warn("Endpoint {} of service {} marked unhealthy: {}", endpoint.getUrl(), serviceName, failure.getKind());
        }
    }

    // ---------------------------------------------------------------- 健康

    /**
     * 应用一次健康探测结果
     */
    public void applyProbeResult(Endpoint endpoint, ProbeResult result) {
        Instant now = Instant.now(clock);
        HealthStatus before = endpoint.getHealth().getStatus();
        if (result.isHealthy()) {
            endpoint.markHealthy(result.getResponseTimeMs(), now);
            if (before != HealthStatus.HEALTHY) {
                log.info("Endpoint {} of service {} is healthy ({}ms)", endpoint.getUrl(), serviceName, result.getResponseTimeMs());
            }
        } else {
            endpoint.markUnhealthy(result.getError(), result.getResponseTimeMs(), now);
            if (before != HealthStatus.UNHEALTHY) {
                log.warn("Endpoint {} of service {} failed health check: {}", endpoint.getUrl(), serviceName, result.getError());
            }
        }
    }

    public void recordHealthCheck(Instant checkedAt) {
        this.lastHealthCheck = checkedAt;
    }

    public HealthSummaryDto getHealthSummary() {
        int total = 0;
        int healthy = 0;
        int unhealthy = 0;
        int unknown = 0;
        for (Endpoint endpoint : endpoints) {
            total++;
            switch (endpoint.getHealth().getStatus()) {
                case HEALTHY:
                    healthy++;
                    break;
                case UNHEALTHY:
                    unhealthy++;
                    break;
                default:
                    unknown++;
            }
        }
        double percentage = total == 0 ? 0.0d : (healthy * 100.0d) / total;
        return new HealthSummaryDto(total, healthy, unhealthy, unknown, percentage);
    }

    public PoolStatsDto getStats() {
        List<Endpoint> snapshot = getEndpoints();
        int healthy = 0;
        int connections = 0;
        long latencySum = 0;
        int latencySamples = 0;
        List<EndpointStatusDto> details = new ArrayList<>();
        for (Endpoint endpoint : snapshot) {
            EndpointHealth health = endpoint.getHealth();
            if (endpoint.isHealthy()) {
                healthy++;
            }
            connections += endpoint.getCurrentConnections();
            if (health.getResponseTimeMs() != null) {
                latencySum += health.getResponseTimeMs();
                latencySamples++;
            }
            details.add(toStatus(endpoint));
        }
        PoolStatsDto stats = new PoolStatsDto();
        stats.setServiceName(serviceName);
        stats.setStrategy(settings.getStrategy().label());
        stats.setTotalEndpoints(snapshot.size());
        stats.setHealthyEndpoints(healthy);
        stats.setTotalConnections(connections);
        stats.setAverageResponseTime(latencySamples == 0 ? 0.0d : (double) latencySum / latencySamples);
        stats.setLastHealthCheck(lastHealthCheck == null ? null : lastHealthCheck.toString());
        stats.setEndpoints(details);
        return stats;
    }

    public static EndpointStatusDto toStatus(Endpoint endpoint) {
        EndpointHealth health = endpoint.getHealth();
        EndpointStatusDto dto = new EndpointStatusDto();
        dto.setId(endpoint.getId());
        dto.setUrl(endpoint.getUrl());
        dto.setWeight(endpoint.getWeight());
        dto.setStatus(health.getStatus().label());
        dto.setCurrentConnections(endpoint.getCurrentConnections());
        dto.setResponseTimeMs(health.getResponseTimeMs());
        dto.setLastChecked(health.getLastChecked() == null ? null : health.getLastChecked().toString());
        dto.setLastError(health.getLastError());
        return dto;
    }

    public String getServiceName() {
        return serviceName;
    }

    public LoadBalancingSettings getSettings() {
        return settings.copy();
    }
}
